package lockerhub.model;

import java.time.Instant;

/**
 * Criteria for {@code EventLog.findAll}; results are newest first.
 */
public final class EventFilter {
  private final String kioskId;
  private final Integer lockerId;
  private final EventType type;
  private final String rfidCard;
  private final String deviceId;
  private final String staffUser;
  private final Instant from;
  private final Instant to;
  private final int limit;
  private final int offset;

  private EventFilter(Builder builder) {
    if (builder.limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    if (builder.offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    if (builder.offset > 0 && builder.limit == 0) {
      throw new IllegalArgumentException("offset requires a limit");
    }
    this.kioskId = builder.kioskId;
    this.lockerId = builder.lockerId;
    this.type = builder.type;
    this.rfidCard = builder.rfidCard;
    this.deviceId = builder.deviceId;
    this.staffUser = builder.staffUser;
    this.from = builder.from;
    this.to = builder.to;
    this.limit = builder.limit;
    this.offset = builder.offset;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static EventFilter all() {
    return builder().build();
  }

  public String kioskId() {
    return kioskId;
  }

  public Integer lockerId() {
    return lockerId;
  }

  public EventType type() {
    return type;
  }

  public String rfidCard() {
    return rfidCard;
  }

  public String deviceId() {
    return deviceId;
  }

  public String staffUser() {
    return staffUser;
  }

  /** Inclusive lower bound on the event timestamp. */
  public Instant from() {
    return from;
  }

  /** Inclusive upper bound on the event timestamp. */
  public Instant to() {
    return to;
  }

  /** Maximum rows, {@code 0} for no limit. */
  public int limit() {
    return limit;
  }

  public int offset() {
    return offset;
  }

  public static final class Builder {
    private String kioskId;
    private Integer lockerId;
    private EventType type;
    private String rfidCard;
    private String deviceId;
    private String staffUser;
    private Instant from;
    private Instant to;
    private int limit;
    private int offset;

    private Builder() {}

    public Builder kioskId(String kioskId) {
      this.kioskId = kioskId;
      return this;
    }

    public Builder lockerId(Integer lockerId) {
      this.lockerId = lockerId;
      return this;
    }

    public Builder type(EventType type) {
      this.type = type;
      return this;
    }

    public Builder rfidCard(String rfidCard) {
      this.rfidCard = rfidCard;
      return this;
    }

    public Builder deviceId(String deviceId) {
      this.deviceId = deviceId;
      return this;
    }

    public Builder staffUser(String staffUser) {
      this.staffUser = staffUser;
      return this;
    }

    public Builder from(Instant from) {
      this.from = from;
      return this;
    }

    public Builder to(Instant to) {
      this.to = to;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public EventFilter build() {
      return new EventFilter(this);
    }
  }
}
