package lockerhub.model;

/**
 * Operator-level VIP operations recorded by {@code VipContractRepository.auditVipOperation},
 * each mapped onto the history action it is filed under.
 */
public enum VipOperation {
  CREATE("create", VipHistoryAction.CREATED),
  EXTEND("extend", VipHistoryAction.EXTENDED),
  CHANGE_CARD("change_card", VipHistoryAction.CARD_CHANGED),
  TRANSFER("transfer", VipHistoryAction.TRANSFERRED),
  CANCEL("cancel", VipHistoryAction.CANCELLED),
  APPROVE_TRANSFER("approve_transfer", VipHistoryAction.TRANSFERRED),
  REJECT_TRANSFER("reject_transfer", VipHistoryAction.CANCELLED);

  private final String code;
  private final VipHistoryAction historyAction;

  VipOperation(String code, VipHistoryAction historyAction) {
    this.code = code;
    this.historyAction = historyAction;
  }

  public String code() {
    return code;
  }

  public VipHistoryAction historyAction() {
    return historyAction;
  }
}
