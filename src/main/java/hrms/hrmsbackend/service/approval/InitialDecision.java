package hrms.hrmsbackend.service.approval;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 요청 생성 시 시작 단계와 자동 승인 여부
 */
@Getter
@AllArgsConstructor
public class InitialDecision {

    private final int level;
    private final boolean autoApprove;

    public static InitialDecision atLevel(int level) {
        return new InitialDecision(level, false);
    }

    public static InitialDecision autoApproved() {
        return new InitialDecision(ApprovalStateMachine.LEVEL_ADMIN, true);
    }
}
