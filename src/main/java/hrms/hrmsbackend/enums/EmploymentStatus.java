package hrms.hrmsbackend.enums;

public enum EmploymentStatus {
    PROBATION,
    CONFIRMED,
    NOTICE,
    RESIGNED_PENDING;

    /**
     * 퇴사 예정 상태 (last_working_day 제한 대상)
     */
    public boolean isLeaving() {
        return this == NOTICE || this == RESIGNED_PENDING;
    }
}
