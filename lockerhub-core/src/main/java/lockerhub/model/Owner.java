package lockerhub.model;

import java.util.Objects;

/**
 * The holder of a locker: an RFID card, a phone (device id) or a VIP contract.
 *
 * <p>Type and key always travel together, so a locker either has both or neither.
 */
public record Owner(OwnerType type, String key) {

  public Owner {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(key, "key");
    if (key.isBlank()) {
      throw new IllegalArgumentException("owner key cannot be blank");
    }
  }

  public static Owner rfid(String card) {
    return new Owner(OwnerType.RFID, card);
  }

  public static Owner device(String deviceId) {
    return new Owner(OwnerType.DEVICE, deviceId);
  }

  public static Owner vip(String card) {
    return new Owner(OwnerType.VIP, card);
  }
}
