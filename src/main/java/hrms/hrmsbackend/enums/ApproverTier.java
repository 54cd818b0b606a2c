package hrms.hrmsbackend.enums;

/**
 * 승인 단계 판정에 쓰이는 승인자 등급
 */
public enum ApproverTier {
    SUPERVISOR,
    MANAGER,
    BOSS_OR_DIRECTOR,
    ADMIN;

    public static ApproverTier of(Role role, EmployeeRole employeeRole) {
        if (role != null && role.isAdmin()) {
            return ADMIN;
        }
        if (employeeRole == null) {
            return null;
        }
        return switch (employeeRole) {
            case SUPERVISOR -> SUPERVISOR;
            case MANAGER -> MANAGER;
            case DIRECTOR, BOSS -> BOSS_OR_DIRECTOR;
            case STAFF -> null;
        };
    }
}
