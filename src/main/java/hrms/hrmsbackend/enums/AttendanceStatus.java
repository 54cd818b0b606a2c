package hrms.hrmsbackend.enums;

public enum AttendanceStatus {
    NOT_STARTED,
    WORKING,
    ON_BREAK,
    COMPLETED
}
