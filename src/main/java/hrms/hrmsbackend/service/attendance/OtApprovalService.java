package hrms.hrmsbackend.service.attendance;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.request.attendance.OtBatchRequestDto;
import hrms.hrmsbackend.dto.response.attendance.ClockInRecordResponseDto;
import hrms.hrmsbackend.dto.response.attendance.OtBatchResultDto;
import hrms.hrmsbackend.dto.response.attendance.OtSummaryResponseDto;
import hrms.hrmsbackend.entity.mysql.attendance.ClockInRecord;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.attendance.ClockInRecordRepository;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.notification.NotificationService;
import hrms.hrmsbackend.service.permission.Capability;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionDecision;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.service.permission.Scope;
import hrms.hrmsbackend.template.NotificationTemplate;
import hrms.hrmsbackend.util.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 플래그된 OT 승인/반려.
 * 일괄 처리는 하나의 트랜잭션이며, 조건이 맞지 않는 건은 skipped 로 넘기고 나머지는 계속 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OtApprovalService {

    public static final String ACTION_APPROVE = "approve";
    public static final String ACTION_REJECT = "reject";

    private final ClockInRecordRepository clockInRecordRepository;
    private final EmployeeLookupService employeeLookupService;
    private final PermissionKernel permissionKernel;
    private final NotificationService notificationService;
    private final TransactionRunner transactionRunner;
    private final EssPolicyProperties policy;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ClockInRecordResponseDto> pending(EssPrincipal principal) {
        permissionKernel.requireCapability(principal, Capability.APPROVE_OT);
        Long companyId = requireCompanyContext(principal);

        List<ClockInRecord> records = clockInRecordRepository.findPendingOvertime(companyId, policy.getOtFlagMinutes());
        Map<Long, Employee> owners = employeeLookupService.byIds(
                records.stream().map(ClockInRecord::getEmployeeId).collect(Collectors.toSet()));
        Scope scope = permissionKernel.scopeOf(principal);

        return records.stream()
                .filter(r -> isEligibleOwner(owners.get(r.getEmployeeId())))
                .filter(r -> permissionKernel.checkApproval(principal, scope, owners.get(r.getEmployeeId()), Capability.APPROVE_OT).isAllowed())
                .map(r -> ClockInRecordResponseDto.fromEntity(r, owners.get(r.getEmployeeId())))
                .toList();
    }

    public OtBatchResultDto batch(EssPrincipal principal, OtBatchRequestDto dto) {
        List<Long> ids = dto.getRecordIds();
        if (ids == null || ids.isEmpty()) {
            throw EssException.validation("record_ids must be a non-empty array");
        }
        String action = dto.getAction() != null ? dto.getAction().toLowerCase(Locale.ROOT) : null;
        if (!ACTION_APPROVE.equals(action) && !ACTION_REJECT.equals(action)) {
            throw EssException.validation("action must be either \"approve\" or \"reject\"");
        }
        String reason = dto.getReason() != null ? dto.getReason().trim() : null;
        if (ACTION_REJECT.equals(action) && (reason == null || reason.isEmpty())) {
            throw EssException.validation("reason is required when rejecting OT");
        }
        permissionKernel.requireCapability(principal, Capability.APPROVE_OT);

        return transactionRunner.inSerializable("ot batch " + action, () -> process(principal, ids, action, reason));
    }

    private OtBatchResultDto process(EssPrincipal principal, List<Long> ids, String action, String reason) {
        Map<Long, ClockInRecord> records = clockInRecordRepository.findAllForUpdate(Set.copyOf(ids)).stream()
                .collect(Collectors.toMap(ClockInRecord::getId, Function.identity()));
        Map<Long, Employee> owners = employeeLookupService.byIds(
                records.values().stream().map(ClockInRecord::getEmployeeId).collect(Collectors.toSet()));
        Scope scope = permissionKernel.scopeOf(principal);
        LocalDateTime now = LocalDateTime.now(clock);
        boolean approve = ACTION_APPROVE.equals(action);

        OtBatchResultDto result = new OtBatchResultDto(action);
        for (Long id : ids) {
            ClockInRecord record = records.get(id);
            if (record == null) {
                result.skip(id, "Record not found");
                continue;
            }
            Employee owner = owners.get(record.getEmployeeId());
            if (!record.isOtFlagged() || record.getOtMinutes() == null
                    || record.getOtMinutes() < policy.getOtFlagMinutes() || !isEligibleOwner(owner)) {
                result.skip(id, "No flagged overtime");
                continue;
            }
            if (record.getOtApproved() != null) {
                result.skip(id, "Already processed");
                continue;
            }
            PermissionDecision decision = permissionKernel.checkApproval(principal, scope, owner, Capability.APPROVE_OT);
            if (decision.isDenied()) {
                result.skip(id, skipReason(decision));
                continue;
            }

            record.setOtApproved(approve);
            record.setOtApprovedBy(principal.getId());
            record.setOtApprovedAt(now);
            record.setOtRejectionReason(approve ? null : reason);
            clockInRecordRepository.save(record);

            Map<String, String> variables = approve
                    ? Map.of("hours", OvertimeCalculator.formatHours(record.getOtMinutes()), "date", record.getWorkDate().toString())
                    : Map.of("hours", OvertimeCalculator.formatHours(record.getOtMinutes()), "date", record.getWorkDate().toString(), "reason", reason);
            notificationService.send(owner.getId(), NotificationType.OVERTIME,
                    approve ? NotificationTemplate.OT_APPROVED : NotificationTemplate.OT_REJECTED,
                    variables, RequestKind.OVERTIME.getReferenceType(), record.getId());

            if (approve) {
                result.setApproved(result.getApproved() + 1);
            } else {
                result.setRejected(result.getRejected() + 1);
            }
            result.setProcessed(result.getProcessed() + 1);
        }
        log.info("OT 일괄 {} - by: {}, processed: {}, skipped: {}", action, principal.getLoginId(),
                result.getProcessed(), result.getSkipped().size());
        return result;
    }

    static String skipReason(PermissionDecision decision) {
        return switch (decision.getRule()) {
            case COMPANY, SCOPE -> "No permission for this outlet";
            case HIERARCHY -> "Hierarchy restriction";
            default -> decision.getReason();
        };
    }

    @Transactional(readOnly = true)
    public OtSummaryResponseDto summary(EssPrincipal principal) {
        List<ClockInRecordResponseDto> pending = pending(principal);
        int pendingMinutes = pending.stream().mapToInt(r -> r.getOtMinutes() != null ? r.getOtMinutes() : 0).sum();

        LocalDate firstOfMonth = LocalDate.now(clock).withDayOfMonth(1);
        List<ClockInRecord> decided = clockInRecordRepository.findOvertimeDecidedBetween(principal.getCompanyId(),
                firstOfMonth.atStartOfDay(), firstOfMonth.plusMonths(1).atStartOfDay());
        Map<Long, Employee> owners = employeeLookupService.byIds(
                decided.stream().map(ClockInRecord::getEmployeeId).collect(Collectors.toSet()));
        Scope scope = permissionKernel.scopeOf(principal);
        List<ClockInRecord> visible = decided.stream()
                .filter(r -> owners.containsKey(r.getEmployeeId()))
                .filter(r -> {
                    Employee owner = owners.get(r.getEmployeeId());
                    return scope.covers(owner.getCompanyId(), owner.getOutletId(), owner.getDepartmentId());
                })
                .toList();

        return OtSummaryResponseDto.builder()
                .pendingCount(pending.size())
                .pendingHours(OvertimeCalculator.formatHours(pendingMinutes))
                .approvedThisMonth((int) visible.stream().filter(r -> Boolean.TRUE.equals(r.getOtApproved())).count())
                .rejectedThisMonth((int) visible.stream().filter(r -> Boolean.FALSE.equals(r.getOtApproved())).count())
                .build();
    }

    private static boolean isEligibleOwner(Employee owner) {
        return owner != null && !owner.isPartTime();
    }

    private static Long requireCompanyContext(EssPrincipal principal) {
        if (principal.getCompanyId() == null) {
            throw EssException.validation("Select a company context first");
        }
        return principal.getCompanyId();
    }
}
