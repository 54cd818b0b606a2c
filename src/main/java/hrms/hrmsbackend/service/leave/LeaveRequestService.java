package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.request.leave.EncashmentRequestDto;
import hrms.hrmsbackend.dto.request.leave.LeaveApplyRequestDto;
import hrms.hrmsbackend.dto.response.leave.EncashmentResponseDto;
import hrms.hrmsbackend.dto.response.leave.LeaveBalanceResponseDto;
import hrms.hrmsbackend.dto.response.leave.LeaveRequestResponseDto;
import hrms.hrmsbackend.dto.response.leave.LeaveTypeResponseDto;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveBalance;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.entity.mysql.schedule.PublicHoliday;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.leave.LeaveRequestRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveTypeRepository;
import hrms.hrmsbackend.repository.mysql.schedule.PublicHolidayRepository;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.Capability;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.service.permission.ScopeResolver;
import hrms.hrmsbackend.util.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 휴가 신청/조회/승인 진입점
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaveRequestService {

    private static final List<RequestStatus> ACTIVE_STATUSES = List.of(RequestStatus.PENDING, RequestStatus.APPROVED);

    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final PublicHolidayRepository publicHolidayRepository;
    private final LeaveBalanceService leaveBalanceService;
    private final LeaveRequestKind leaveRequestKind;
    private final RequestLifecycleService lifecycle;
    private final PermissionKernel permissionKernel;
    private final ScopeResolver scopeResolver;
    private final EmployeeLookupService employeeLookupService;
    private final TransactionRunner transactionRunner;
    private final EssPolicyProperties policy;
    private final Clock clock;

    public LeaveRequestResponseDto apply(EssPrincipal principal, LeaveApplyRequestDto dto) {
        LeaveRequest created = transactionRunner.inSerializable("apply leave", () -> {
            Employee employee = employeeLookupService.requireSelf(principal);
            Company company = scopeResolver.requireCompany(employee.getCompanyId());
            LeaveType type = requireTypeForCompany(dto.getLeaveTypeId(), employee.getCompanyId());
            LocalDate today = LocalDate.now(clock);

            validateDates(type, employee, dto.getStartDate(), dto.getEndDate(), today);

            // 횟수 제한과 잔액 모두 휴가 시작일의 연도 기준
            int leaveYear = dto.getStartDate().getYear();
            long used = leaveRequestRepository.countOccurrences(employee.getId(), type.getId(), ACTIVE_STATUSES,
                    LocalDate.of(leaveYear, 1, 1), LocalDate.of(leaveYear, 12, 31));
            LeaveEligibility.check(type, employee, today, used, dto.getMcUrl())
                    .ifPresent(reason -> {
                        throw EssException.validation(reason);
                    });

            if (leaveRequestRepository.existsOverlapping(employee.getId(), dto.getStartDate(), dto.getEndDate(), ACTIVE_STATUSES)) {
                throw EssException.conflict("You already have a leave request for these dates");
            }

            double totalDays = countDays(company, type, dto.getStartDate(), dto.getEndDate(), Boolean.TRUE.equals(dto.getHalfDay()));
            if (totalDays <= 0) {
                throw EssException.validation("Selected dates contain no working days");
            }

            if (type.isPaidType()) {
                LeaveBalance balance = leaveBalanceService.ensureBalance(employee, type, leaveYear);
                if (balance.getAvailableDays() < totalDays) {
                    throw EssException.validation(LeaveBalanceService.insufficientMessage(balance.getAvailableDays(), totalDays));
                }
            }

            LeaveRequest request = new LeaveRequest();
            request.setLeaveTypeId(type.getId());
            request.setStartDate(dto.getStartDate());
            request.setEndDate(dto.getEndDate());
            request.setTotalDays(totalDays);
            request.setHalfDay(totalDays == WorkingDayCounter.HALF_DAY);
            request.setReason(dto.getReason());
            request.setMcUrl(dto.getMcUrl());
            request.setBalanceYear(leaveYear);
            return lifecycle.open(leaveRequestKind, request, employee, company);
        });
        return toDto(created);
    }

    void validateDates(LeaveType type, Employee employee, LocalDate start, LocalDate end, LocalDate today) {
        if (end.isBefore(start)) {
            throw EssException.validation("End date cannot be before start date");
        }
        if (start.isBefore(today)) {
            if (!type.isAttachmentRequired()) {
                throw EssException.validation("Cannot apply for leave on past dates");
            }
            int backdate = policy.getMedicalBackdateDays();
            if (start.isBefore(today.minusDays(backdate))) {
                throw EssException.validation("Medical leave can only be backdated up to " + backdate + " days");
            }
        }
        if (employee.getEmploymentStatus() != null && employee.getEmploymentStatus().isLeaving()
                && employee.getLastWorkingDay() != null && end.isAfter(employee.getLastWorkingDay())) {
            throw EssException.validation("Leave cannot extend beyond your last working day ("
                    + employee.getLastWorkingDay() + ")");
        }
    }

    double countDays(Company company, LeaveType type, LocalDate start, LocalDate end, boolean halfDay) {
        Set<LocalDate> holidays = publicHolidayRepository.findApplicable(company.getId(), start, end).stream()
                .map(PublicHoliday::getDate)
                .collect(Collectors.toSet());
        return WorkingDayCounter.count(start, end, company.getEffectiveWorkingWeek(), holidays,
                type.isConsecutiveType(), halfDay);
    }

    @Transactional(readOnly = true)
    public List<LeaveRequestResponseDto> myRequests(EssPrincipal principal, RequestStatus status, Integer year) {
        Employee employee = employeeLookupService.requireSelf(principal);
        Map<Long, LeaveType> types = typesById(employee.getCompanyId());
        return leaveRequestRepository.findByEmployeeIdOrderByStartDateDesc(employee.getId()).stream()
                .filter(r -> status == null || r.getStatus() == status)
                .filter(r -> year == null || r.getStartDate().getYear() == year)
                .map(r -> LeaveRequestResponseDto.fromEntity(r, types.get(r.getLeaveTypeId()), employee))
                .toList();
    }

    @Transactional(readOnly = true)
    public LeaveRequestResponseDto getRequest(EssPrincipal principal, Long id) {
        LeaveRequest request = leaveRequestRepository.findById(id)
                .orElseThrow(() -> EssException.notFound("Leave request"));
        Employee owner = employeeLookupService.require(request.getEmployeeId());
        if (!owner.getId().equals(principal.getEmployeeId())) {
            permissionKernel.requireApproval(principal, owner, Capability.APPROVE_LEAVE);
        }
        return toDto(request, owner);
    }

    @Transactional
    public List<LeaveTypeResponseDto> leaveTypes(EssPrincipal principal) {
        Employee employee = employeeLookupService.requireSelf(principal);
        LocalDate today = LocalDate.now(clock);
        return leaveTypeRepository.findAvailableForCompany(employee.getCompanyId()).stream()
                .map(type -> LeaveTypeResponseDto.of(type, LeaveEligibility.genderReason(type, employee)
                        .or(() -> LeaveEligibility.serviceReason(type, employee, today))
                        .orElse(null)))
                .toList();
    }

    /**
     * 잔여 조회. 행이 없으면 이 시점에 생성된다.
     */
    @Transactional
    public List<LeaveBalanceResponseDto> balances(EssPrincipal principal, Integer year) {
        Employee employee = employeeLookupService.requireSelf(principal);
        Company company = scopeResolver.requireCompany(employee.getCompanyId());
        LocalDate today = LocalDate.now(clock);
        int targetYear = year != null ? year : today.getYear();

        return leaveTypeRepository.findAvailableForCompany(employee.getCompanyId()).stream()
                .filter(type -> LeaveEligibility.genderReason(type, employee).isEmpty())
                .map(type -> {
                    LeaveBalance balance = leaveBalanceService.ensureBalance(employee, type, targetYear);
                    EntitlementCalculator.Proration proration = EntitlementCalculator.prorate(
                            nz(balance.getEntitledDays()), nz(balance.getCarriedForward()), nz(balance.getUsedDays()),
                            employee.getJoinDate(), today, company.getLeaveProrationRounding());
                    return LeaveBalanceResponseDto.of(type, balance, proration);
                })
                .toList();
    }

    public LeaveRequestResponseDto approve(EssPrincipal principal, Long id) {
        return toDto(lifecycle.approve(leaveRequestKind, id, principal));
    }

    public LeaveRequestResponseDto reject(EssPrincipal principal, Long id, String reason) {
        return toDto(lifecycle.reject(leaveRequestKind, id, principal, reason));
    }

    public LeaveRequestResponseDto cancel(EssPrincipal principal, Long id) {
        return toDto(lifecycle.cancel(leaveRequestKind, id, principal));
    }

    public LeaveRequestResponseDto revert(EssPrincipal principal, Long id) {
        return toDto(lifecycle.revert(leaveRequestKind, id, principal));
    }

    /**
     * 승인자가 지금 처리할 수 있는 대기 건
     */
    @Transactional(readOnly = true)
    public List<LeaveRequestResponseDto> pendingForApprover(EssPrincipal principal) {
        List<LeaveRequest> pending = lifecycle.pendingFor(leaveRequestKind, principal, (companyId, levels) ->
                leaveRequestRepository.findByCompanyIdAndStatusAndApprovalLevelIn(companyId, RequestStatus.PENDING, levels));
        Map<Long, Employee> owners = employeeLookupService.byIds(
                pending.stream().map(LeaveRequest::getEmployeeId).collect(Collectors.toSet()));
        Map<Long, LeaveType> types = typesById(principal.getCompanyId());
        return pending.stream()
                .map(r -> LeaveRequestResponseDto.fromEntity(r, types.get(r.getLeaveTypeId()), owners.get(r.getEmployeeId())))
                .toList();
    }

    public long pendingCount(EssPrincipal principal) {
        return pendingForApprover(principal).size();
    }

    @Transactional
    public EncashmentResponseDto encashment(EssPrincipal principal, EncashmentRequestDto dto) {
        Employee employee = employeeLookupService.require(dto.getEmployeeId());
        employeeLookupService.requireSameCompany(principal, employee);
        int year = dto.getYear() != null ? dto.getYear() : LocalDate.now(clock).getYear();

        LeaveType annual = leaveTypeRepository.findAvailableForCompany(employee.getCompanyId()).stream()
                .filter(t -> "AL".equalsIgnoreCase(t.getCode()))
                .findFirst()
                .orElseThrow(() -> EssException.notFound("Annual leave type"));
        LeaveBalance balance = leaveBalanceService.ensureBalance(employee, annual, year);
        double remaining = Math.max(0.0, balance.getAvailableDays());
        BigDecimal rate = dto.getRate() != null ? dto.getRate() : BigDecimal.ONE;

        return EncashmentResponseDto.builder()
                .employeeId(employee.getId())
                .year(year)
                .remainingDays(remaining)
                .basicSalary(employee.getBasicSalary())
                .rate(rate)
                .amount(EntitlementCalculator.encashment(remaining, employee.getBasicSalary(), rate))
                .build();
    }

    public LeaveBalanceService.YearInitResult initializeYear(EssPrincipal principal, int year) {
        if (principal.getCompanyId() == null) {
            throw EssException.validation("Select a company context first");
        }
        Company company = scopeResolver.requireCompany(principal.getCompanyId());
        return transactionRunner.inSerializable("initialize leave year", () -> leaveBalanceService.initializeYear(company, year));
    }

    private LeaveType requireTypeForCompany(Long leaveTypeId, Long companyId) {
        LeaveType type = leaveTypeRepository.findById(leaveTypeId)
                .orElseThrow(() -> EssException.notFound("Leave type"));
        if (!Boolean.TRUE.equals(type.getActive())
                || (type.getCompanyId() != null && !type.getCompanyId().equals(companyId))) {
            throw EssException.validation("This leave type is not available for your company");
        }
        return type;
    }

    private Map<Long, LeaveType> typesById(Long companyId) {
        return leaveTypeRepository.findAvailableForCompany(companyId).stream()
                .collect(Collectors.toMap(LeaveType::getId, Function.identity()));
    }

    private LeaveRequestResponseDto toDto(LeaveRequest request) {
        return toDto(request, employeeLookupService.require(request.getEmployeeId()));
    }

    private LeaveRequestResponseDto toDto(LeaveRequest request, Employee owner) {
        Optional<LeaveType> type = leaveTypeRepository.findById(request.getLeaveTypeId());
        return LeaveRequestResponseDto.fromEntity(request, type.orElse(null), owner);
    }

    private static double nz(Double value) {
        return value != null ? value : 0.0;
    }
}
