package hrms.hrmsbackend.enums;

public enum SwapStatus {
    PENDING_TARGET,       // 상대방 응답 대기
    PENDING_SUPERVISOR,   // 상대방 수락, 슈퍼바이저 승인 대기
    APPROVED,
    REJECTED,
    CANCELLED;

    public boolean isPending() {
        return this == PENDING_TARGET || this == PENDING_SUPERVISOR;
    }
}
