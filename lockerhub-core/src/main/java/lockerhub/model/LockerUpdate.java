package lockerhub.model;

import lockerhub.ValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Set of column changes for a versioned locker update.
 *
 * <p>Only fields explicitly set on the builder are written; identity, version and
 * audit timestamps cannot be changed through an update. A {@code null} value for a
 * set field clears the column.
 *
 * <pre>{@code
 * LockerUpdate update = LockerUpdate.builder()
 *     .status(LockerStatus.RESERVED)
 *     .owner(Owner.rfid("0009652489"))
 *     .reservedAt(now)
 *     .build();
 * }</pre>
 */
public final class LockerUpdate {
  public static final int MAX_DISPLAY_NAME_LENGTH = 20;

  public enum Field {
    STATUS,
    OWNER,
    RESERVED_AT,
    OWNED_AT,
    VIP,
    DISPLAY_NAME
  }

  private final Map<Field, Object> changes;
  private final String nameUpdatedBy;

  private LockerUpdate(Builder builder) {
    if (builder.changes.isEmpty()) {
      throw new ValidationException("update must change at least one field");
    }
    if (builder.changes.containsKey(Field.STATUS) && builder.changes.get(Field.STATUS) == null) {
      throw new IllegalArgumentException("status cannot be cleared");
    }
    if (builder.changes.containsKey(Field.DISPLAY_NAME) && builder.nameUpdatedBy == null) {
      throw new IllegalArgumentException("display name changes require updatedBy");
    }
    this.changes = Collections.unmodifiableMap(new EnumMap<>(builder.changes));
    this.nameUpdatedBy = builder.nameUpdatedBy;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean has(Field field) {
    return changes.containsKey(field);
  }

  public Map<Field, Object> changes() {
    return changes;
  }

  public LockerStatus status() {
    return (LockerStatus) changes.get(Field.STATUS);
  }

  public Owner owner() {
    return (Owner) changes.get(Field.OWNER);
  }

  public Instant reservedAt() {
    return (Instant) changes.get(Field.RESERVED_AT);
  }

  public Instant ownedAt() {
    return (Instant) changes.get(Field.OWNED_AT);
  }

  public Boolean vip() {
    return (Boolean) changes.get(Field.VIP);
  }

  public String displayName() {
    return (String) changes.get(Field.DISPLAY_NAME);
  }

  public String nameUpdatedBy() {
    return nameUpdatedBy;
  }

  static String validateDisplayName(String displayName) {
    String trimmed = displayName.trim();
    if (trimmed.isEmpty()) {
      throw new ValidationException("display name cannot be blank");
    }
    if (trimmed.length() > MAX_DISPLAY_NAME_LENGTH) {
      throw new ValidationException(
          "display name must be at most " + MAX_DISPLAY_NAME_LENGTH + " characters");
    }
    return trimmed;
  }

  @Override
  public String toString() {
    return "LockerUpdate" + changes;
  }

  public static final class Builder {
    private final Map<Field, Object> changes = new EnumMap<>(Field.class);
    private String nameUpdatedBy;

    private Builder() {}

    public Builder status(LockerStatus status) {
      changes.put(Field.STATUS, Objects.requireNonNull(status, "status"));
      return this;
    }

    /** Sets the holder; {@code null} clears both owner type and key. */
    public Builder owner(Owner owner) {
      changes.put(Field.OWNER, owner);
      return this;
    }

    public Builder clearOwner() {
      changes.put(Field.OWNER, null);
      changes.put(Field.RESERVED_AT, null);
      changes.put(Field.OWNED_AT, null);
      return this;
    }

    public Builder reservedAt(Instant reservedAt) {
      changes.put(Field.RESERVED_AT, reservedAt);
      return this;
    }

    public Builder ownedAt(Instant ownedAt) {
      changes.put(Field.OWNED_AT, ownedAt);
      return this;
    }

    public Builder vip(boolean vip) {
      changes.put(Field.VIP, vip);
      return this;
    }

    /**
     * Renames the locker. Names are trimmed and limited to
     * {@value LockerUpdate#MAX_DISPLAY_NAME_LENGTH} characters; {@code null} removes the name.
     */
    public Builder displayName(String displayName, String updatedBy) {
      Objects.requireNonNull(updatedBy, "updatedBy");
      changes.put(Field.DISPLAY_NAME, displayName == null ? null : validateDisplayName(displayName));
      this.nameUpdatedBy = updatedBy;
      return this;
    }

    public LockerUpdate build() {
      return new LockerUpdate(this);
    }
  }
}
