package hrms.hrmsbackend.enums;

public enum ApprovalAction {
    APPROVE,
    REJECT,
    CANCEL,
    REVERT
}
