package lockerhub.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request to enqueue a command for a kiosk.
 *
 * <p>Each request is assigned a ULID-based {@code commandId} unless one is given,
 * so ids sort by creation time.
 *
 * @see lockerhub.CommandQueue#enqueue(CommandRequest)
 */
public final class CommandRequest {
  public static final int DEFAULT_MAX_RETRIES = 3;

  private final String commandId;
  private final String kioskId;
  private final CommandType type;
  private final Map<String, Object> payload;
  private final int maxRetries;
  private final Instant notBefore;

  private CommandRequest(Builder builder) {
    this.commandId = builder.commandId == null ? newCommandId() : builder.commandId;
    this.kioskId = Objects.requireNonNull(builder.kioskId, "kioskId");
    if (kioskId.isBlank()) {
      throw new IllegalArgumentException("kioskId cannot be blank");
    }
    this.type = Objects.requireNonNull(builder.type, "type");
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    this.maxRetries = builder.maxRetries;
    this.payload = builder.payload == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
    this.notBefore = builder.notBefore;
  }

  public static Builder builder(String kioskId, CommandType type) {
    return new Builder(kioskId, type);
  }

  public static CommandRequest of(String kioskId, CommandType type, Map<String, Object> payload) {
    return builder(kioskId, type).payload(payload).build();
  }

  private static String newCommandId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  public String commandId() {
    return commandId;
  }

  public String kioskId() {
    return kioskId;
  }

  public CommandType type() {
    return type;
  }

  public Map<String, Object> payload() {
    return payload;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns the earliest dispatch time, or {@code null} to make the command due immediately.
   */
  public Instant notBefore() {
    return notBefore;
  }

  @Override
  public String toString() {
    return "CommandRequest{commandId=" + commandId + ", kioskId=" + kioskId
        + ", type=" + type.code() + ", maxRetries=" + maxRetries + "}";
  }

  public static final class Builder {
    private String commandId;
    private final String kioskId;
    private final CommandType type;
    private Map<String, Object> payload;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Instant notBefore;

    private Builder(String kioskId, CommandType type) {
      this.kioskId = kioskId;
      this.type = type;
    }

    public Builder commandId(String commandId) {
      this.commandId = commandId;
      return this;
    }

    public Builder payload(Map<String, Object> payload) {
      this.payload = payload;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder notBefore(Instant notBefore) {
      this.notBefore = notBefore;
      return this;
    }

    public CommandRequest build() {
      return new CommandRequest(this);
    }
  }
}
