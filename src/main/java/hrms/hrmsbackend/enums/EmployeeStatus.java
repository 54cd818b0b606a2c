package hrms.hrmsbackend.enums;

public enum EmployeeStatus {
    ACTIVE,
    INACTIVE,
    RESIGNED
}
