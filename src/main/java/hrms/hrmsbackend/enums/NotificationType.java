package hrms.hrmsbackend.enums;

public enum NotificationType {
    LEAVE,
    OVERTIME,
    CLAIM,
    EXTRA_SHIFT,
    SHIFT_SWAP,
    LETTER,
    SYSTEM
}
