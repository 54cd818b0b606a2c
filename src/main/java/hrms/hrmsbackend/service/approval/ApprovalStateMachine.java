package hrms.hrmsbackend.service.approval;

import hrms.hrmsbackend.entity.mysql.approval.ApprovableRequest;
import hrms.hrmsbackend.enums.ApproverTier;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.EssException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 승인 상태 전이 규칙.
 *
 * <pre>
 * pending(L1) ─supervisor/manager/boss─► pending(L2|L3) ─► pending(L3) ─admin─► approved
 *      └────────────── reject ─────────────────────────────────────────────► rejected
 *      └────────────── cancel (본인, pending 일 때만) ──────────────────────► cancelled
 * </pre>
 *
 * 권한(계층/범위) 검사는 호출 측에서 먼저 끝내야 한다. 여기서는 단계와 등급만 본다.
 */
@Component
public class ApprovalStateMachine {

    public static final int LEVEL_SUPERVISOR = 1;
    public static final int LEVEL_MANAGER = 2;
    public static final int LEVEL_ADMIN = 3;

    public static final String NOT_PENDING = "This request is no longer pending";

    /**
     * 승인자 등급별로 승인 가능한 대기 레벨.
     * boss/director 는 L3 를 반려만 할 수 있으므로 승인 대기 목록에서 L3 는 제외한다.
     */
    public static List<Integer> actionableLevels(ApproverTier tier) {
        if (tier == null) {
            return Collections.emptyList();
        }
        return switch (tier) {
            case SUPERVISOR -> List.of(LEVEL_SUPERVISOR);
            case MANAGER -> List.of(LEVEL_SUPERVISOR, LEVEL_MANAGER);
            case BOSS_OR_DIRECTOR -> List.of(LEVEL_SUPERVISOR, LEVEL_MANAGER);
            case ADMIN -> List.of(LEVEL_ADMIN);
        };
    }

    public ApprovalOutcome approve(ApprovableRequest request, ApproverTier tier, Long actorId, LocalDateTime at) {
        requirePending(request);
        if (tier == null) {
            throw EssException.forbidden("You do not have permission to approve this request");
        }
        int level = currentLevel(request);

        switch (tier) {
            case SUPERVISOR -> {
                if (level != LEVEL_SUPERVISOR) {
                    throw EssException.forbidden("Supervisors can only approve requests at level 1");
                }
                fillSupervisor(request, actorId, at);
                request.setApprovalLevel(LEVEL_MANAGER);
                return ApprovalOutcome.ADVANCED;
            }
            case MANAGER -> {
                if (level >= LEVEL_ADMIN) {
                    throw EssException.forbidden("This request is awaiting admin approval");
                }
                // L1 에서 매니저가 승인하면 슈퍼바이저 단계까지 함께 채운다
                if (level == LEVEL_SUPERVISOR) {
                    fillSupervisor(request, actorId, at);
                }
                fillManager(request, actorId, at);
                request.setApprovalLevel(LEVEL_ADMIN);
                return ApprovalOutcome.ADVANCED;
            }
            case BOSS_OR_DIRECTOR -> {
                if (level >= LEVEL_ADMIN) {
                    throw EssException.forbidden("This request is awaiting admin approval");
                }
                if (request.getSupervisorId() == null) {
                    fillSupervisor(request, actorId, at);
                }
                if (request.getManagerId() == null) {
                    fillManager(request, actorId, at);
                }
                request.setApprovalLevel(LEVEL_ADMIN);
                return ApprovalOutcome.ADVANCED;
            }
            case ADMIN -> {
                if (level != LEVEL_ADMIN) {
                    throw EssException.forbidden("This request is awaiting level " + level + " approval");
                }
                request.setStatus(RequestStatus.APPROVED);
                request.setApprovedBy(actorId);
                request.setApprovedAt(at);
                return ApprovalOutcome.APPROVED;
            }
            default -> throw EssException.internal("Unhandled approver tier: " + tier);
        }
    }

    public void reject(ApprovableRequest request, ApproverTier tier, Long actorId, String reason, LocalDateTime at) {
        requirePending(request);
        if (tier == null) {
            throw EssException.forbidden("You do not have permission to reject this request");
        }
        int level = currentLevel(request);
        boolean allowed = switch (tier) {
            case SUPERVISOR -> level == LEVEL_SUPERVISOR;
            case MANAGER -> level <= LEVEL_MANAGER;
            case BOSS_OR_DIRECTOR, ADMIN -> true;
        };
        if (!allowed) {
            throw EssException.forbidden("You cannot reject a request at approval level " + level);
        }
        markRejected(request, actorId, tier.name().toLowerCase(Locale.ROOT), reason, at);
    }

    /**
     * 정책에 의한 자동 반려 (승인 기한 만료 등)
     */
    public void expire(ApprovableRequest request, String reason, LocalDateTime at) {
        requirePending(request);
        markRejected(request, null, "system", reason, at);
    }

    public void cancelByOwner(ApprovableRequest request, LocalDateTime at) {
        if (request.getStatus() != RequestStatus.PENDING) {
            throw EssException.conflict("Only pending requests can be cancelled");
        }
        request.setStatus(RequestStatus.CANCELLED);
        request.setCancelledAt(at);
    }

    /**
     * 관리자 취소. 승인된 요청이면 true 를 돌려주고 호출 측이 차감분을 되돌린다.
     */
    public boolean cancelByAdmin(ApprovableRequest request, LocalDateTime at) {
        RequestStatus status = request.getStatus();
        if (status != RequestStatus.PENDING && status != RequestStatus.APPROVED) {
            throw EssException.conflict("Only pending or approved requests can be cancelled");
        }
        request.setStatus(RequestStatus.CANCELLED);
        request.setCancelledAt(at);
        return status == RequestStatus.APPROVED;
    }

    /**
     * 자동 승인 건을 관리자 승인 대기(L3)로 되돌린다
     */
    public void revertAutoApproval(ApprovableRequest request, String kindName) {
        if (!request.isAutoApproved()) {
            throw EssException.validation("This " + kindName + " was not auto-approved");
        }
        if (request.getStatus() != RequestStatus.APPROVED) {
            throw EssException.validation(capitalize(kindName) + " is no longer in approved status");
        }
        request.setStatus(RequestStatus.PENDING);
        request.setApprovalLevel(LEVEL_ADMIN);
        request.setAutoApproved(false);
        request.setApprovedBy(null);
        request.setApprovedAt(null);
    }

    private void markRejected(ApprovableRequest request, Long actorId, String role, String reason, LocalDateTime at) {
        request.setStatus(RequestStatus.REJECTED);
        request.setRejectedBy(actorId);
        request.setRejectedByRole(role);
        request.setRejectedAt(at);
        request.setRejectionReason(reason);
    }

    private void requirePending(ApprovableRequest request) {
        if (request.getStatus() != RequestStatus.PENDING) {
            throw EssException.conflict(NOT_PENDING);
        }
    }

    private int currentLevel(ApprovableRequest request) {
        return request.getApprovalLevel() != null ? request.getApprovalLevel() : LEVEL_SUPERVISOR;
    }

    private void fillSupervisor(ApprovableRequest request, Long actorId, LocalDateTime at) {
        request.setSupervisorId(actorId);
        request.setSupervisorApprovedAt(at);
    }

    private void fillManager(ApprovableRequest request, Long actorId, LocalDateTime at) {
        request.setManagerId(actorId);
        request.setManagerApprovedAt(at);
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
