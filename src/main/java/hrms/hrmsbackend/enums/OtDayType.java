package hrms.hrmsbackend.enums;

public enum OtDayType {
    NORMAL,
    WEEKEND,
    PUBLIC_HOLIDAY
}
