package hrms.hrmsbackend.enums;

import lombok.Getter;

@Getter
public enum EmployeeRole {
    STAFF("staff"),
    SUPERVISOR("supervisor"),
    MANAGER("manager"),
    DIRECTOR("director"),
    BOSS("boss");

    private final String value;

    EmployeeRole(String value) {
        this.value = value;
    }

    public boolean isBossOrDirector() {
        return this == BOSS || this == DIRECTOR;
    }

    /**
     * 승인 권한이 있는 역할인지 (supervisor 이상)
     */
    public boolean isApproverRole() {
        return this != STAFF;
    }

    public static EmployeeRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STAFF;
        }
        for (EmployeeRole role : values()) {
            if (role.value.equalsIgnoreCase(value.trim()) || role.name().equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown employee role: " + value);
    }
}
