package lockerhub.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of audit events.
 *
 * <p>{@link #requiresStaffUser()} types can only be written as a
 * {@link NewEvent.StaffAction}. Rows whose code is not listed here (written by other
 * components sharing the {@code events} table) read back as {@link #OTHER} with their
 * raw code kept on {@link Event#typeCode()}.
 */
public enum EventType {
  RESTARTED("restarted"),
  KIOSK_ONLINE("kiosk_online"),
  KIOSK_OFFLINE("kiosk_offline"),
  RFID_ASSIGN("rfid_assign"),
  RFID_RELEASE("rfid_release"),
  QR_ASSIGN("qr_assign"),
  QR_RELEASE("qr_release"),
  STAFF_OPEN("staff_open"),
  STAFF_BLOCK("staff_block"),
  STAFF_UNBLOCK("staff_unblock"),
  BULK_OPEN("bulk_open"),
  MASTER_PIN_USED("master_pin_used"),
  VIP_CONTRACT_CREATED("vip_contract_created"),
  VIP_CONTRACT_EXTENDED("vip_contract_extended"),
  VIP_CONTRACT_CANCELLED("vip_contract_cancelled"),
  VIP_CARD_CHANGED("vip_card_changed"),
  VIP_TRANSFER_REQUESTED("vip_transfer_requested"),
  VIP_TRANSFER_APPROVED("vip_transfer_approved"),
  VIP_TRANSFER_REJECTED("vip_transfer_rejected"),
  VIP_TRANSFER_COMPLETED("vip_transfer_completed"),
  VIP_TRANSFER_CANCELLED("vip_transfer_cancelled"),
  COMMAND_FAILED("command_failed"),
  HARDWARE_ERROR("hardware_error"),
  ERROR_RESOLVED("error_resolved"),
  CONFIG_PACKAGE_CREATED("config_package_created"),
  CONFIG_DEPLOYMENT_INITIATED("config_deployment_initiated"),
  CONFIG_APPLIED("config_applied"),
  CONFIG_ROLLBACK("config_rollback"),
  PROVISIONING_TOKEN_GENERATED("provisioning_token_generated"),
  KIOSK_REGISTERED("kiosk_registered"),
  KIOSK_ENROLLED("kiosk_enrolled"),
  PROVISIONING_ROLLBACK("provisioning_rollback"),
  /** Stored code this version does not know; never written. */
  OTHER("other");

  private static final Set<EventType> STAFF_AUDITED = EnumSet.of(
      STAFF_OPEN, STAFF_BLOCK, STAFF_UNBLOCK, BULK_OPEN, MASTER_PIN_USED,
      VIP_CONTRACT_CREATED, VIP_CONTRACT_EXTENDED, VIP_CONTRACT_CANCELLED);

  private final String code;

  EventType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Staff-initiated hardware actions must name the staff member who performed them. */
  public boolean requiresStaffUser() {
    return this == STAFF_OPEN || this == STAFF_BLOCK || this == STAFF_UNBLOCK;
  }

  /** Types returned by {@code EventLog.findStaffActions}. */
  public static Set<EventType> staffAudited() {
    return STAFF_AUDITED;
  }

  /**
   * @throws IllegalArgumentException if {@code code} names no known type
   */
  public static EventType fromCode(String code) {
    EventType type = fromStoredCode(code);
    if (type == OTHER) {
      throw new IllegalArgumentException("Unknown event type: " + code);
    }
    return type;
  }

  /** Maps a persisted code, falling back to {@link #OTHER} for codes not listed here. */
  public static EventType fromStoredCode(String code) {
    for (EventType type : values()) {
      if (type != OTHER && type.code.equals(code)) {
        return type;
      }
    }
    return OTHER;
  }
}
