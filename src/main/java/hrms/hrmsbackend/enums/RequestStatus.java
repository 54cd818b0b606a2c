package hrms.hrmsbackend.enums;

public enum RequestStatus {
    PENDING,            // 승인 대기 (approval_level 단계 진행 중)
    APPROVED,           // 최종 승인
    REJECTED,           // 반려
    CANCELLED;          // 신청자 취소 또는 관리자 취소

    /**
     * 승인 대기 상태인지 확인
     */
    public boolean isPending() {
        return this == PENDING;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == CANCELLED;
    }
}
