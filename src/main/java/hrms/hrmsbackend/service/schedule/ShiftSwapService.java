package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.dto.request.schedule.ShiftSwapRequestDto;
import hrms.hrmsbackend.dto.response.schedule.ShiftSwapResponseDto;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.entity.mysql.schedule.ShiftSwapRequest;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestKind;
import hrms.hrmsbackend.enums.SwapStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ScheduleRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ShiftSwapRequestRepository;
import hrms.hrmsbackend.service.attendance.ClockInService;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 근무 교대 요청.
 * pending_target → (상대 수락) pending_supervisor → approved / rejected.
 * 상대 거절은 rejected, 요청자 취소는 pending_target 에서만 가능하다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftSwapService {

    private static final List<SwapStatus> OPEN_STATUSES = List.of(SwapStatus.PENDING_TARGET, SwapStatus.PENDING_SUPERVISOR);

    private final ShiftSwapRequestRepository shiftSwapRequestRepository;
    private final ScheduleRepository scheduleRepository;
    private final EmployeeRepository employeeRepository;
    private final EmployeeLookupService employeeLookupService;
    private final PermissionKernel permissionKernel;
    private final NotificationService notificationService;
    private final ClockInService clockInService;
    private final TransactionRunner transactionRunner;
    private final Clock clock;

    public ShiftSwapResponseDto request(EssPrincipal principal, ShiftSwapRequestDto dto) {
        if (dto.getRequesterShiftId() == null || dto.getTargetId() == null || dto.getTargetShiftId() == null) {
            throw EssException.validation("Requester shift, target employee, and target shift are required");
        }
        return transactionRunner.inSerializable("request shift swap", () -> {
            Employee requester = employeeLookupService.requireSelf(principal);
            if (requester.getOutletId() == null) {
                throw EssException.validation("Shift swaps are only available for outlet-based companies");
            }
            LocalDate today = LocalDate.now(clock);

            Schedule requesterShift = scheduleRepository.findById(dto.getRequesterShiftId())
                    .filter(s -> s.getEmployeeId().equals(requester.getId()) && s.isWorkingShift())
                    .orElseThrow(() -> EssException.validation("Invalid requester shift or not your shift"));
            if (requesterShift.getScheduleDate().isBefore(today)) {
                throw EssException.validation("Cannot swap past shifts");
            }

            Employee target = employeeLookupService.require(dto.getTargetId());
            if (target.getId().equals(requester.getId())) {
                throw EssException.validation("You cannot swap shifts with yourself");
            }
            Schedule targetShift = scheduleRepository.findById(dto.getTargetShiftId())
                    .filter(s -> s.getEmployeeId().equals(target.getId()) && s.isWorkingShift())
                    .orElseThrow(() -> EssException.validation("Invalid target shift or not their shift"));
            if (!Objects.equals(target.getOutletId(), requester.getOutletId())) {
                throw EssException.validation("Target employee must be in the same outlet");
            }
            if (targetShift.getScheduleDate().isBefore(today)) {
                throw EssException.validation("Cannot swap past shifts");
            }

            if (shiftSwapRequestRepository.existsActiveForShifts(Set.of(requesterShift.getId(), targetShift.getId()), OPEN_STATUSES)) {
                throw EssException.validation("One of these shifts already has a pending swap request");
            }
            checkNoDoubleBooking(requesterShift, targetShift);

            ShiftSwapRequest swap = new ShiftSwapRequest();
            swap.setCompanyId(requester.getCompanyId());
            swap.setOutletId(requester.getOutletId());
            swap.setRequesterId(requester.getId());
            swap.setRequesterShiftId(requesterShift.getId());
            swap.setTargetId(target.getId());
            swap.setTargetShiftId(targetShift.getId());
            swap.setReason(dto.getReason());
            swap.setStatus(SwapStatus.PENDING_TARGET);
            ShiftSwapRequest saved = shiftSwapRequestRepository.save(swap);

            Map<String, String> variables = variables(requester, target, requesterShift, targetShift);
            notify(target.getId(), NotificationTemplate.SWAP_REQUESTED, variables, saved.getId());
            log.info("근무 교대 요청 - id: {}, requester: {}, target: {}", saved.getId(),
                    requester.getEmployeeCode(), target.getEmployeeCode());
            return ShiftSwapResponseDto.fromEntity(saved, requester, target, requesterShift, targetShift);
        });
    }

    /**
     * 교대 후 같은 날짜에 두 건이 생기지 않는지 확인
     */
    private void checkNoDoubleBooking(Schedule requesterShift, Schedule targetShift) {
        if (requesterShift.getScheduleDate().equals(targetShift.getScheduleDate())) {
            return;
        }
        boolean requesterBusy = scheduleRepository.findByEmployeeIdAndScheduleDate(requesterShift.getEmployeeId(), targetShift.getScheduleDate())
                .filter(s -> !s.getId().equals(requesterShift.getId()))
                .isPresent();
        if (requesterBusy) {
            throw EssException.validation("You already have a shift on the target date");
        }
        boolean targetBusy = scheduleRepository.findByEmployeeIdAndScheduleDate(targetShift.getEmployeeId(), requesterShift.getScheduleDate())
                .filter(s -> !s.getId().equals(targetShift.getId()))
                .isPresent();
        if (targetBusy) {
            throw EssException.validation("Target employee already has a shift on your shift date");
        }
    }

    public ShiftSwapResponseDto respond(EssPrincipal principal, Long swapId, String response) {
        boolean accepted = "accepted".equalsIgnoreCase(response);
        if (!accepted && !"rejected".equalsIgnoreCase(response)) {
            throw EssException.validation("Response must be \"accepted\" or \"rejected\"");
        }
        return transactionRunner.inSerializable("respond shift swap", () -> {
            ShiftSwapRequest swap = lock(swapId);
            if (!swap.getTargetId().equals(principal.getEmployeeId())) {
                throw EssException.forbidden("You are not the target of this swap request");
            }
            if (swap.getStatus() != SwapStatus.PENDING_TARGET) {
                throw EssException.conflict("This request has already been responded to");
            }
            swap.setTargetRespondedAt(LocalDateTime.now(clock));
            swap.setStatus(accepted ? SwapStatus.PENDING_SUPERVISOR : SwapStatus.REJECTED);
            ShiftSwapRequest saved = shiftSwapRequestRepository.save(swap);

            SwapContext ctx = context(saved);
            Map<String, String> variables = variables(ctx.requester, ctx.target, ctx.requesterShift, ctx.targetShift);
            if (accepted) {
                notify(saved.getRequesterId(), NotificationTemplate.SWAP_ACCEPTED, variables, saved.getId());
                employeeRepository.findFirstByOutletIdAndEmployeeRoleAndStatus(saved.getOutletId(), EmployeeRole.SUPERVISOR, EmployeeStatus.ACTIVE)
                        .ifPresent(supervisor -> notify(supervisor.getId(), NotificationTemplate.SWAP_APPROVAL_REQUIRED, variables, saved.getId()));
            } else {
                notify(saved.getRequesterId(), NotificationTemplate.SWAP_DECLINED, variables, saved.getId());
            }
            log.info("근무 교대 응답 - id: {}, accepted: {}", swapId, accepted);
            return ctx.toDto();
        });
    }

    public ShiftSwapResponseDto cancel(EssPrincipal principal, Long swapId) {
        return transactionRunner.inSerializable("cancel shift swap", () -> {
            ShiftSwapRequest swap = lock(swapId);
            if (!swap.getRequesterId().equals(principal.getEmployeeId())) {
                throw EssException.forbidden("You can only cancel your own requests");
            }
            if (swap.getStatus() != SwapStatus.PENDING_TARGET) {
                throw EssException.conflict("Cannot cancel request that has already been accepted or processed");
            }
            swap.setStatus(SwapStatus.CANCELLED);
            shiftSwapRequestRepository.save(swap);
            log.info("근무 교대 취소 - id: {}", swapId);
            return context(swap).toDto();
        });
    }

    /**
     * 승인 시 두 스케줄의 담당자를 서로 바꾼다. 같은 날짜면 근무 내용을 바꾼다.
     */
    public ShiftSwapResponseDto approve(EssPrincipal principal, Long swapId) {
        permissionKernel.requireCapability(principal, Capability.APPROVE_SWAPS);
        return transactionRunner.inSerializable("approve shift swap", () -> {
            ShiftSwapRequest swap = lockPendingSupervisor(swapId);
            SwapContext ctx = context(swap);
            requireApprover(principal, ctx);

            Schedule requesterShift = scheduleRepository.findWithLockById(swap.getRequesterShiftId())
                    .orElseThrow(() -> EssException.notFound("Schedule"));
            Schedule targetShift = scheduleRepository.findWithLockById(swap.getTargetShiftId())
                    .orElseThrow(() -> EssException.notFound("Schedule"));
            if (!requesterShift.getEmployeeId().equals(swap.getRequesterId())
                    || !targetShift.getEmployeeId().equals(swap.getTargetId())) {
                throw EssException.conflict("The shifts in this swap request have changed");
            }
            checkNoDoubleBooking(requesterShift, targetShift);

            if (requesterShift.getScheduleDate().equals(targetShift.getScheduleDate())) {
                swapShiftDetails(requesterShift, targetShift);
            } else {
                reassign(requesterShift, ctx.target);
                reassign(targetShift, ctx.requester);
            }
            scheduleRepository.save(requesterShift);
            scheduleRepository.save(targetShift);
            resync(requesterShift, targetShift);

            swap.setStatus(SwapStatus.APPROVED);
            swap.setSupervisorId(principal.getId());
            swap.setSupervisorDecidedAt(LocalDateTime.now(clock));
            shiftSwapRequestRepository.save(swap);

            Map<String, String> variables = variables(ctx.requester, ctx.target, ctx.requesterShift, ctx.targetShift);
            notify(swap.getRequesterId(), NotificationTemplate.SWAP_APPROVED, variables, swap.getId());
            notify(swap.getTargetId(), NotificationTemplate.SWAP_APPROVED, variables, swap.getId());
            log.info("근무 교대 승인 - id: {}, by: {}", swapId, principal.getLoginId());
            return ctx.toDto();
        });
    }

    public ShiftSwapResponseDto reject(EssPrincipal principal, Long swapId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw EssException.validation("Rejection reason is required");
        }
        permissionKernel.requireCapability(principal, Capability.APPROVE_SWAPS);
        return transactionRunner.inSerializable("reject shift swap", () -> {
            ShiftSwapRequest swap = lockPendingSupervisor(swapId);
            SwapContext ctx = context(swap);
            requireApprover(principal, ctx);

            swap.setStatus(SwapStatus.REJECTED);
            swap.setSupervisorId(principal.getId());
            swap.setSupervisorDecidedAt(LocalDateTime.now(clock));
            swap.setRejectionReason(reason);
            shiftSwapRequestRepository.save(swap);

            Map<String, String> variables = variables(ctx.requester, ctx.target, ctx.requesterShift, ctx.targetShift);
            variables.put("reason", reason);
            notify(swap.getRequesterId(), NotificationTemplate.SWAP_REJECTED, variables, swap.getId());
            notify(swap.getTargetId(), NotificationTemplate.SWAP_REJECTED, variables, swap.getId());
            log.info("근무 교대 반려 - id: {}, by: {}", swapId, principal.getLoginId());
            return ctx.toDto();
        });
    }

    @Transactional(readOnly = true)
    public List<ShiftSwapResponseDto> mySwaps(EssPrincipal principal) {
        Employee me = employeeLookupService.requireSelf(principal);
        return shiftSwapRequestRepository.findInvolving(me.getId()).stream()
                .map(swap -> context(swap).toDto())
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ShiftSwapResponseDto> pendingForApprover(EssPrincipal principal) {
        permissionKernel.requireCapability(principal, Capability.APPROVE_SWAPS);
        if (principal.getCompanyId() == null) {
            throw EssException.validation("Select a company context first");
        }
        Scope scope = permissionKernel.scopeOf(principal);
        return shiftSwapRequestRepository.findByCompanyIdAndStatus(principal.getCompanyId(), SwapStatus.PENDING_SUPERVISOR).stream()
                .map(this::context)
                .filter(ctx -> firstDenial(principal, scope, ctx) == null)
                .map(SwapContext::toDto)
                .toList();
    }

    private void requireApprover(EssPrincipal principal, SwapContext ctx) {
        PermissionDecision denial = firstDenial(principal, permissionKernel.scopeOf(principal), ctx);
        if (denial != null) {
            throw EssException.forbidden(denial.getReason());
        }
    }

    /**
     * 두 직원 모두에 대해 승인 권한이 있어야 한다
     */
    private PermissionDecision firstDenial(EssPrincipal principal, Scope scope, SwapContext ctx) {
        return Stream.of(ctx.requester, ctx.target)
                .map(e -> permissionKernel.checkApproval(principal, scope, e, Capability.APPROVE_SWAPS))
                .filter(PermissionDecision::isDenied)
                .findFirst()
                .orElse(null);
    }

    private static void reassign(Schedule schedule, Employee newOwner) {
        schedule.setEmployeeId(newOwner.getId());
        schedule.setOutletId(newOwner.getOutletId());
        schedule.setDepartmentId(newOwner.getDepartmentId());
    }

    private static void swapShiftDetails(Schedule a, Schedule b) {
        Long template = a.getShiftTemplateId();
        a.setShiftTemplateId(b.getShiftTemplateId());
        b.setShiftTemplateId(template);

        var start = a.getShiftStart();
        a.setShiftStart(b.getShiftStart());
        b.setShiftStart(start);

        var end = a.getShiftEnd();
        a.setShiftEnd(b.getShiftEnd());
        b.setShiftEnd(end);

        Integer breakDuration = a.getBreakDuration();
        a.setBreakDuration(b.getBreakDuration());
        b.setBreakDuration(breakDuration);
    }

    private void resync(Schedule... schedules) {
        for (Schedule schedule : schedules) {
            clockInService.syncSchedule(schedule.getEmployeeId(), schedule.getScheduleDate(), schedule);
        }
    }

    private ShiftSwapRequest lock(Long swapId) {
        return shiftSwapRequestRepository.findWithLockById(swapId)
                .orElseThrow(() -> EssException.notFound("Swap request"));
    }

    private ShiftSwapRequest lockPendingSupervisor(Long swapId) {
        ShiftSwapRequest swap = lock(swapId);
        if (swap.getStatus() != SwapStatus.PENDING_SUPERVISOR) {
            throw EssException.conflict("This swap request is not pending supervisor approval");
        }
        return swap;
    }

    private SwapContext context(ShiftSwapRequest swap) {
        Map<Long, Employee> employees = employeeLookupService.byIds(Set.of(swap.getRequesterId(), swap.getTargetId()));
        Map<Long, Schedule> shifts = scheduleRepository.findAllById(Set.of(swap.getRequesterShiftId(), swap.getTargetShiftId())).stream()
                .collect(Collectors.toMap(Schedule::getId, s -> s));
        return new SwapContext(swap, employees.get(swap.getRequesterId()), employees.get(swap.getTargetId()),
                shifts.get(swap.getRequesterShiftId()), shifts.get(swap.getTargetShiftId()));
    }

    private static Map<String, String> variables(Employee requester, Employee target, Schedule requesterShift, Schedule targetShift) {
        Map<String, String> variables = new HashMap<>();
        variables.put("requesterName", requester != null ? requester.getName() : "");
        variables.put("targetName", target != null ? target.getName() : "");
        variables.put("requesterDate", requesterShift != null ? requesterShift.getScheduleDate().toString() : "");
        variables.put("targetDate", targetShift != null ? targetShift.getScheduleDate().toString() : "");
        return variables;
    }

    private void notify(Long employeeId, NotificationTemplate template, Map<String, String> variables, Long swapId) {
        notificationService.send(employeeId, NotificationType.SHIFT_SWAP, template, variables,
                RequestKind.SHIFT_SWAP.getReferenceType(), swapId);
    }

    private static class SwapContext {
        private final ShiftSwapRequest swap;
        private final Employee requester;
        private final Employee target;
        private final Schedule requesterShift;
        private final Schedule targetShift;

        SwapContext(ShiftSwapRequest swap, Employee requester, Employee target, Schedule requesterShift, Schedule targetShift) {
            this.swap = swap;
            this.requester = requester;
            this.target = target;
            this.requesterShift = requesterShift;
            this.targetShift = targetShift;
        }

        ShiftSwapResponseDto toDto() {
            return ShiftSwapResponseDto.fromEntity(swap, requester, target, requesterShift, targetShift);
        }
    }
}
