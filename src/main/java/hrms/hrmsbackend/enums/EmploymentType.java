package hrms.hrmsbackend.enums;

public enum EmploymentType {
    PERMANENT,
    CONTRACT,
    PART_TIME,
    INTERN
}
