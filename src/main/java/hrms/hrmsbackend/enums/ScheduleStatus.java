package hrms.hrmsbackend.enums;

public enum ScheduleStatus {
    SCHEDULED,
    OFF,
    ON_LEAVE
}
