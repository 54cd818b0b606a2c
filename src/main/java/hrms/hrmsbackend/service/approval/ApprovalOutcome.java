package hrms.hrmsbackend.service.approval;

public enum ApprovalOutcome {
    ADVANCED,   // 다음 단계로 이동 (여전히 pending)
    APPROVED    // 최종 승인
}
