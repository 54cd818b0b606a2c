package hrms.hrmsbackend.service.approval;

import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.enums.ApproverTier;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.ErrorKind;
import hrms.hrmsbackend.exception.EssException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApprovalStateMachine 단위 테스트")
class ApprovalStateMachineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 2, 9, 0);

    private ApprovalStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        stateMachine = new ApprovalStateMachine();
    }

    private static LeaveRequest pendingAt(int level) {
        LeaveRequest request = new LeaveRequest();
        request.setStatus(RequestStatus.PENDING);
        request.setApprovalLevel(level);
        return request;
    }

    @Test
    @DisplayName("슈퍼바이저 → 매니저 → 관리자 순서로 최종 승인")
    void fullChain() {
        LeaveRequest request = pendingAt(1);

        assertThat(stateMachine.approve(request, ApproverTier.SUPERVISOR, 10L, NOW)).isEqualTo(ApprovalOutcome.ADVANCED);
        assertThat(request.getApprovalLevel()).isEqualTo(2);
        assertThat(request.getSupervisorId()).isEqualTo(10L);

        assertThat(stateMachine.approve(request, ApproverTier.MANAGER, 20L, NOW)).isEqualTo(ApprovalOutcome.ADVANCED);
        assertThat(request.getApprovalLevel()).isEqualTo(3);
        assertThat(request.getManagerId()).isEqualTo(20L);

        assertThat(stateMachine.approve(request, ApproverTier.ADMIN, 1L, NOW)).isEqualTo(ApprovalOutcome.APPROVED);
        assertThat(request.getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(request.getApprovedBy()).isEqualTo(1L);
    }

    @Test
    @DisplayName("매니저가 L1 에서 승인하면 슈퍼바이저 단계도 채워진다")
    void managerAtLevelOneFillsSupervisor() {
        LeaveRequest request = pendingAt(1);

        stateMachine.approve(request, ApproverTier.MANAGER, 20L, NOW);

        assertThat(request.getSupervisorId()).isEqualTo(20L);
        assertThat(request.getManagerId()).isEqualTo(20L);
        assertThat(request.getApprovalLevel()).isEqualTo(3);
    }

    @Test
    @DisplayName("슈퍼바이저는 L2 요청을 승인할 수 없다")
    void supervisorCannotApproveLevelTwo() {
        LeaveRequest request = pendingAt(2);

        assertThatThrownBy(() -> stateMachine.approve(request, ApproverTier.SUPERVISOR, 10L, NOW))
                .isInstanceOf(EssException.class)
                .extracting("kind").isEqualTo(ErrorKind.AUTHORIZATION);
    }

    @Test
    @DisplayName("관리자는 L3 이전 요청을 최종 승인할 수 없다")
    void adminWaitsForLevelThree() {
        LeaveRequest request = pendingAt(1);

        assertThatThrownBy(() -> stateMachine.approve(request, ApproverTier.ADMIN, 1L, NOW))
                .hasMessage("This request is awaiting level 1 approval");
    }

    @Test
    @DisplayName("이미 처리된 요청은 Conflict")
    void notPendingIsConflict() {
        LeaveRequest request = pendingAt(3);
        request.setStatus(RequestStatus.REJECTED);

        assertThatThrownBy(() -> stateMachine.approve(request, ApproverTier.ADMIN, 1L, NOW))
                .isInstanceOf(EssException.class)
                .hasMessage(ApprovalStateMachine.NOT_PENDING)
                .extracting("kind").isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    @DisplayName("매니저는 L3 요청을 반려할 수 없고 boss 는 가능하다")
    void rejectByLevel() {
        LeaveRequest request = pendingAt(3);

        assertThatThrownBy(() -> stateMachine.reject(request, ApproverTier.MANAGER, 20L, "no", NOW))
                .isInstanceOf(EssException.class);

        stateMachine.reject(request, ApproverTier.BOSS_OR_DIRECTOR, 30L, "Short staffed", NOW);

        assertThat(request.getStatus()).isEqualTo(RequestStatus.REJECTED);
        assertThat(request.getRejectedByRole()).isEqualTo("boss_or_director");
        assertThat(request.getRejectionReason()).isEqualTo("Short staffed");
    }

    @Test
    @DisplayName("본인 취소는 pending 일 때만")
    void ownerCancelOnlyWhilePending() {
        LeaveRequest request = pendingAt(1);
        stateMachine.cancelByOwner(request, NOW);
        assertThat(request.getStatus()).isEqualTo(RequestStatus.CANCELLED);

        LeaveRequest approved = pendingAt(3);
        approved.setStatus(RequestStatus.APPROVED);
        assertThatThrownBy(() -> stateMachine.cancelByOwner(approved, NOW))
                .hasMessage("Only pending requests can be cancelled");
    }

    @Test
    @DisplayName("관리자 취소: 승인 건이면 차감 복원 신호를 돌려준다")
    void adminCancelOfApproved() {
        LeaveRequest approved = pendingAt(3);
        approved.setStatus(RequestStatus.APPROVED);

        assertThat(stateMachine.cancelByAdmin(approved, NOW)).isTrue();
        assertThat(approved.getStatus()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(stateMachine.cancelByAdmin(pendingAt(1), NOW)).isFalse();
    }

    @Test
    @DisplayName("자동 승인 되돌리기는 L3 pending 으로 돌아간다")
    void revertAutoApproval() {
        LeaveRequest request = pendingAt(3);
        request.setStatus(RequestStatus.APPROVED);
        request.setAutoApproved(true);
        request.setApprovedAt(NOW);

        stateMachine.revertAutoApproval(request, "leave");

        assertThat(request.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(request.getApprovalLevel()).isEqualTo(3);
        assertThat(request.isAutoApproved()).isFalse();
        assertThat(request.getApprovedAt()).isNull();
    }

    @Test
    @DisplayName("자동 승인이 아닌 건은 되돌릴 수 없다")
    void revertRequiresAutoApproval() {
        LeaveRequest request = pendingAt(3);
        request.setStatus(RequestStatus.APPROVED);

        assertThatThrownBy(() -> stateMachine.revertAutoApproval(request, "leave"))
                .hasMessage("This leave was not auto-approved");
    }

    @Test
    @DisplayName("등급별 승인 가능 레벨, boss/director 목록에는 반려만 가능한 L3 가 없다")
    void actionableLevels() {
        assertThat(ApprovalStateMachine.actionableLevels(ApproverTier.SUPERVISOR)).containsExactly(1);
        assertThat(ApprovalStateMachine.actionableLevels(ApproverTier.MANAGER)).containsExactly(1, 2);
        assertThat(ApprovalStateMachine.actionableLevels(ApproverTier.BOSS_OR_DIRECTOR)).containsExactly(1, 2)
                .doesNotContain(ApprovalStateMachine.LEVEL_ADMIN);
        assertThat(ApprovalStateMachine.actionableLevels(ApproverTier.ADMIN)).containsExactly(3);
        assertThat(ApprovalStateMachine.actionableLevels(null)).isEmpty();
    }
}
