package hrms.hrmsbackend.enums;

public enum WorkType {
    FULL_TIME,
    PART_TIME
}
