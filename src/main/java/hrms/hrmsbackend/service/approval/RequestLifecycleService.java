package hrms.hrmsbackend.service.approval;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.entity.mysql.approval.ApprovableRequest;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.employee.EmployeeOutlet;
import hrms.hrmsbackend.enums.ApproverTier;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeOutletRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.service.notification.NotificationService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.service.permission.Scope;
import hrms.hrmsbackend.template.NotificationTemplate;
import hrms.hrmsbackend.util.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 휴가/클레임/추가근무 요청의 공통 승인 흐름.
 * 모든 전이는 하나의 SERIALIZABLE 트랜잭션 안에서
 * (1) 상태 재조회 (2) 권한 재검사 (3) 상태 변경 (4) 신청자 알림 1건 순서로 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestLifecycleService {

    private final ApprovalStateMachine stateMachine;
    private final PermissionKernel permissionKernel;
    private final NotificationService notificationService;
    private final EmployeeRepository employeeRepository;
    private final EmployeeOutletRepository employeeOutletRepository;
    private final TransactionRunner transactionRunner;
    private final EssPolicyProperties policy;
    private final Clock clock;

    /**
     * 새 요청 등록. 호출 측 트랜잭션 안에서 실행된다.
     */
    public <T extends ApprovableRequest> T open(RequestKindHandler<T> handler, T request, Employee owner, Company company) {
        InitialDecision decision = handler.onCreate(request, owner, company);
        LocalDateTime now = LocalDateTime.now(clock);

        request.setEmployeeId(owner.getId());
        request.setCompanyId(owner.getCompanyId());
        request.setOutletId(owner.getOutletId());
        request.setDepartmentId(owner.getDepartmentId());
        request.setApprovalLevel(decision.getLevel());

        if (decision.isAutoApprove()) {
            request.setStatus(RequestStatus.APPROVED);
            request.setAutoApproved(true);
            request.setApprovedAt(now);
            handler.onApproved(request);
            T saved = handler.save(request);
            notifyRequester(handler, saved, NotificationTemplate.REQUEST_AUTO_APPROVED, Map.of());
            log.info("{} 자동 승인 - id: {}, employee: {}", handler.kind(), saved.getId(), owner.getEmployeeCode());
            return saved;
        }

        request.setStatus(RequestStatus.PENDING);
        request.setAutoApproved(false);
        T saved = handler.save(request);
        notifyNextApprover(handler, saved, owner);
        log.info("{} 신청 - id: {}, employee: {}, level: {}", handler.kind(), saved.getId(),
                owner.getEmployeeCode(), saved.getApprovalLevel());
        return saved;
    }

    public <T extends ApprovableRequest> T approve(RequestKindHandler<T> handler, Long requestId, EssPrincipal principal) {
        return transactionRunner.inSerializable("approve " + handler.kind(), () -> {
            T request = handler.lockForTransition(requestId);
            if (request.getStatus() != RequestStatus.PENDING) {
                throw EssException.conflict(ApprovalStateMachine.NOT_PENDING);
            }
            Employee owner = requireOwner(request);
            permissionKernel.requireApproval(principal, owner, handler.capability());

            ApproverTier tier = ApproverTier.of(principal.getRole(), principal.getEmployeeRole());
            ApprovalOutcome outcome = stateMachine.approve(request, tier, principal.getId(), LocalDateTime.now(clock));
            if (outcome == ApprovalOutcome.APPROVED) {
                handler.onApproved(request);
            }
            T saved = handler.save(request);

            if (outcome == ApprovalOutcome.APPROVED) {
                notifyRequester(handler, saved, NotificationTemplate.REQUEST_APPROVED, Map.of());
            } else {
                notifyRequester(handler, saved, NotificationTemplate.REQUEST_ADVANCED, Map.of(
                        "approverName", nullToEmpty(principal.getName()),
                        "level", String.valueOf(saved.getApprovalLevel())));
            }
            log.info("{} 승인 - id: {}, by: {}({}), outcome: {}, level: {}", handler.kind(), requestId,
                    principal.getLoginId(), tier, outcome, saved.getApprovalLevel());
            return saved;
        });
    }

    public <T extends ApprovableRequest> T reject(RequestKindHandler<T> handler, Long requestId,
                                                 EssPrincipal principal, String reason) {
        return transactionRunner.inSerializable("reject " + handler.kind(), () -> {
            T request = handler.lockForTransition(requestId);
            if (request.getStatus() != RequestStatus.PENDING) {
                throw EssException.conflict(ApprovalStateMachine.NOT_PENDING);
            }
            Employee owner = requireOwner(request);
            permissionKernel.requireApproval(principal, owner, handler.capability());

            ApproverTier tier = ApproverTier.of(principal.getRole(), principal.getEmployeeRole());
            stateMachine.reject(request, tier, principal.getId(), reason, LocalDateTime.now(clock));
            handler.onRejected(request);
            T saved = handler.save(request);

            notifyRequester(handler, saved, NotificationTemplate.REQUEST_REJECTED,
                    Map.of("reason", reason != null && !reason.isBlank() ? reason : "No reason given"));
            log.info("{} 반려 - id: {}, by: {}({})", handler.kind(), requestId, principal.getLoginId(), tier);
            return saved;
        });
    }

    /**
     * 본인 취소는 pending 일 때만, 관리자는 승인 건도 취소 가능 (차감 복원)
     */
    public <T extends ApprovableRequest> T cancel(RequestKindHandler<T> handler, Long requestId, EssPrincipal principal) {
        return transactionRunner.inSerializable("cancel " + handler.kind(), () -> {
            T request = handler.lockForTransition(requestId);
            LocalDateTime now = LocalDateTime.now(clock);

            if (principal.isAdmin()) {
                Employee owner = requireOwner(request);
                if (!principal.isSuperAdmin() || principal.getCompanyId() != null) {
                    if (!owner.getCompanyId().equals(principal.getCompanyId())) {
                        throw EssException.forbidden("Employee does not belong to your company");
                    }
                }
                boolean wasApproved = stateMachine.cancelByAdmin(request, now);
                if (wasApproved) {
                    handler.onReversed(request);
                }
            } else {
                if (!request.getEmployeeId().equals(principal.getEmployeeId())) {
                    throw EssException.forbidden("You can only cancel your own requests");
                }
                stateMachine.cancelByOwner(request, now);
            }
            T saved = handler.save(request);
            notifyRequester(handler, saved, NotificationTemplate.REQUEST_CANCELLED, Map.of());
            log.info("{} 취소 - id: {}, by: {}", handler.kind(), requestId, principal.getLoginId());
            return saved;
        });
    }

    /**
     * 자동 승인된 요청을 본인이 되돌린다. 차감분을 복원하고 관리자 승인 대기(L3)로 돌아간다.
     */
    public <T extends ApprovableRequest> T revert(RequestKindHandler<T> handler, Long requestId, EssPrincipal principal) {
        String kindName = handler.kind().getDisplayName().toLowerCase(Locale.ROOT);
        return transactionRunner.inSerializable("revert " + handler.kind(), () -> {
            T request = handler.lockForTransition(requestId);
            if (principal.isAdmin() || !request.getEmployeeId().equals(principal.getEmployeeId())) {
                throw EssException.forbidden("You can only revert your own " + kindName + " requests");
            }
            int window = policy.getRevertWindowDays();
            if (window > 0 && request.getApprovedAt() != null
                    && request.getApprovedAt().plusDays(window).isBefore(LocalDateTime.now(clock))) {
                throw EssException.validation("The revert window of " + window + " days has passed");
            }
            stateMachine.revertAutoApproval(request, kindName);
            handler.onReversed(request);
            T saved = handler.save(request);
            notifyRequester(handler, saved, NotificationTemplate.REQUEST_REVERTED, Map.of());
            log.info("{} 자동승인 되돌림 - id: {}, by: {}", handler.kind(), requestId, principal.getLoginId());
            return saved;
        });
    }

    /**
     * 승인 기한이 지난 pending 요청을 시스템이 반려한다
     */
    public <T extends ApprovableRequest> boolean expire(RequestKindHandler<T> handler, Long requestId, String reason) {
        return transactionRunner.inSerializable("expire " + handler.kind(), () -> {
            T request = handler.lockForTransition(requestId);
            if (request.getStatus() != RequestStatus.PENDING) {
                return false;
            }
            stateMachine.expire(request, reason, LocalDateTime.now(clock));
            handler.onRejected(request);
            T saved = handler.save(request);
            notifyRequester(handler, saved, NotificationTemplate.REQUEST_REJECTED, Map.of("reason", reason));
            log.info("{} 기한 만료 반려 - id: {}", handler.kind(), requestId);
            return true;
        });
    }

    /**
     * 승인자에게 보이는 대기 건. 레벨로 1차 조회 후 요청마다 권한을 다시 판정한다.
     */
    public <T extends ApprovableRequest> List<T> pendingFor(RequestKindHandler<T> handler, EssPrincipal principal,
                                                          BiFunction<Long, List<Integer>, List<T>> finder) {
        permissionKernel.requireCapability(principal, handler.capability());
        if (principal.getCompanyId() == null) {
            throw EssException.validation("Select a company context first");
        }
        List<Integer> levels = ApprovalStateMachine.actionableLevels(
                ApproverTier.of(principal.getRole(), principal.getEmployeeRole()));
        if (levels.isEmpty()) {
            return Collections.emptyList();
        }
        List<T> pending = finder.apply(principal.getCompanyId(), levels);
        Map<Long, Employee> owners = employeeRepository.findByIdIn(
                        pending.stream().map(ApprovableRequest::getEmployeeId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));
        Scope scope = permissionKernel.scopeOf(principal);
        return pending.stream()
                .filter(r -> owners.containsKey(r.getEmployeeId()))
                .filter(r -> permissionKernel.checkApproval(principal, scope, owners.get(r.getEmployeeId()),
                        handler.capability()).isAllowed())
                .toList();
    }

    private Employee requireOwner(ApprovableRequest request) {
        return employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> EssException.notFound("Employee"));
    }

    private <T extends ApprovableRequest> void notifyRequester(RequestKindHandler<T> handler, T request,
                                                               NotificationTemplate template, Map<String, String> extra) {
        Map<String, String> variables = baseVariables(handler, request);
        variables.putAll(extra);
        notificationService.send(request.getEmployeeId(), handler.notificationType(), template, variables,
                handler.kind().getReferenceType(), request.getId());
    }

    private <T extends ApprovableRequest> void notifyNextApprover(RequestKindHandler<T> handler, T request, Employee owner) {
        Optional<Employee> approver = findNextApprover(request.getApprovalLevel(), owner);
        if (approver.isEmpty()) {
            // 관리자 단계(L3)이거나 담당자가 없음
            log.debug("{} id: {} 다음 승인자 없음 (level {})", handler.kind(), request.getId(), request.getApprovalLevel());
            return;
        }
        Map<String, String> variables = baseVariables(handler, request);
        variables.put("requesterName", nullToEmpty(owner.getName()));
        notificationService.send(approver.get().getId(), handler.notificationType(), NotificationTemplate.REQUEST_SUBMITTED,
                variables, handler.kind().getReferenceType(), request.getId());
    }

    Optional<Employee> findNextApprover(Integer level, Employee owner) {
        if (level == null || level >= ApprovalStateMachine.LEVEL_ADMIN) {
            return Optional.empty();
        }
        EmployeeRole role = level == ApprovalStateMachine.LEVEL_SUPERVISOR ? EmployeeRole.SUPERVISOR : EmployeeRole.MANAGER;
        Optional<Employee> candidate;
        if (owner.getOutletId() != null) {
            candidate = employeeRepository.findFirstByOutletIdAndEmployeeRoleAndStatus(owner.getOutletId(), role, EmployeeStatus.ACTIVE);
            if (candidate.isEmpty() && role == EmployeeRole.MANAGER) {
                // 여러 매장을 맡은 매니저는 employee_outlets 로만 연결되어 있을 수 있음
                candidate = employeeOutletRepository.findByOutletId(owner.getOutletId()).stream()
                        .map(EmployeeOutlet::getEmployeeId)
                        .map(employeeRepository::findById)
                        .flatMap(Optional::stream)
                        .filter(e -> e.getEmployeeRole() == EmployeeRole.MANAGER && e.isActive())
                        .findFirst();
            }
        } else if (owner.getDepartmentId() != null) {
            candidate = employeeRepository.findFirstByDepartmentIdAndEmployeeRoleAndStatus(owner.getDepartmentId(), role, EmployeeStatus.ACTIVE);
        } else {
            candidate = Optional.empty();
        }
        return candidate.filter(e -> !e.getId().equals(owner.getId()));
    }

    private <T extends ApprovableRequest> Map<String, String> baseVariables(RequestKindHandler<T> handler, T request) {
        Map<String, String> variables = new HashMap<>();
        variables.put("kind", handler.kind().getDisplayName());
        variables.put("kindLower", handler.kind().getDisplayName().toLowerCase(Locale.ROOT));
        variables.put("summary", handler.summarize(request));
        return variables;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
