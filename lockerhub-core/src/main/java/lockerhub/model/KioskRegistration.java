package lockerhub.model;

import java.util.Objects;

/**
 * Registration (or re-registration) of a kiosk with the heartbeat registry.
 */
public final class KioskRegistration {
  public static final String DEFAULT_VERSION = "1.0.0";
  public static final int DEFAULT_OFFLINE_THRESHOLD_SECONDS = 30;

  private final String kioskId;
  private final String zone;
  private final String version;
  private final String hardwareId;
  private final String registrationSecret;
  private final int offlineThresholdSeconds;

  private KioskRegistration(Builder builder) {
    this.kioskId = Objects.requireNonNull(builder.kioskId, "kioskId");
    this.zone = Objects.requireNonNull(builder.zone, "zone");
    if (kioskId.isBlank()) {
      throw new IllegalArgumentException("kioskId cannot be blank");
    }
    if (builder.offlineThresholdSeconds <= 0) {
      throw new IllegalArgumentException(
          "offlineThresholdSeconds must be > 0, got: " + builder.offlineThresholdSeconds);
    }
    this.version = builder.version == null ? DEFAULT_VERSION : builder.version;
    this.hardwareId = builder.hardwareId;
    this.registrationSecret = builder.registrationSecret;
    this.offlineThresholdSeconds = builder.offlineThresholdSeconds;
  }

  public static Builder builder(String kioskId, String zone) {
    return new Builder(kioskId, zone);
  }

  public static KioskRegistration of(String kioskId, String zone) {
    return builder(kioskId, zone).build();
  }

  public String kioskId() {
    return kioskId;
  }

  public String zone() {
    return zone;
  }

  public String version() {
    return version;
  }

  public String hardwareId() {
    return hardwareId;
  }

  public String registrationSecret() {
    return registrationSecret;
  }

  public int offlineThresholdSeconds() {
    return offlineThresholdSeconds;
  }

  public static final class Builder {
    private final String kioskId;
    private final String zone;
    private String version;
    private String hardwareId;
    private String registrationSecret;
    private int offlineThresholdSeconds = DEFAULT_OFFLINE_THRESHOLD_SECONDS;

    private Builder(String kioskId, String zone) {
      this.kioskId = kioskId;
      this.zone = zone;
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public Builder hardwareId(String hardwareId) {
      this.hardwareId = hardwareId;
      return this;
    }

    public Builder registrationSecret(String registrationSecret) {
      this.registrationSecret = registrationSecret;
      return this;
    }

    public Builder offlineThresholdSeconds(int offlineThresholdSeconds) {
      this.offlineThresholdSeconds = offlineThresholdSeconds;
      return this;
    }

    public KioskRegistration build() {
      return new KioskRegistration(this);
    }
  }
}
