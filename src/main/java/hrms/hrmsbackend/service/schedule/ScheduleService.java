package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.request.schedule.ScheduleAssignRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ScheduleBulkAssignRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ScheduleBulkCreateRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ScheduleCreateRequestDto;
import hrms.hrmsbackend.dto.response.schedule.BulkScheduleResultDto;
import hrms.hrmsbackend.dto.response.schedule.ScheduleEditPermissionDto;
import hrms.hrmsbackend.dto.response.schedule.ScheduleResponseDto;
import hrms.hrmsbackend.dto.response.schedule.ShiftTemplateResponseDto;
import hrms.hrmsbackend.dto.response.schedule.WeeklyRosterDto;
import hrms.hrmsbackend.dto.response.schedule.WeeklyValidationDto;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.entity.mysql.schedule.ShiftTemplate;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.enums.ScheduleStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.repository.mysql.schedule.PublicHolidayRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ScheduleRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ShiftTemplateRepository;
import hrms.hrmsbackend.service.attendance.ClockInService;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.Capability;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.service.permission.Scope;
import hrms.hrmsbackend.util.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 스케줄 생성/수정/삭제, 템플릿 배정, 주간 로스터
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final ScheduleRepository scheduleRepository;
    private final ShiftTemplateRepository shiftTemplateRepository;
    private final PublicHolidayRepository publicHolidayRepository;
    private final EmployeeRepository employeeRepository;
    private final EmployeeLookupService employeeLookupService;
    private final PermissionKernel permissionKernel;
    private final ScheduleEditPolicy editPolicy;
    private final ClockInService clockInService;
    private final TransactionRunner transactionRunner;
    private final EssPolicyProperties policy;

    public ScheduleResponseDto create(EssPrincipal principal, ScheduleCreateRequestDto dto) {
        permissionKernel.requireCapability(principal, Capability.MANAGE_SCHEDULE);
        return transactionRunner.inSerializable("create schedule", () -> {
            Schedule saved = createRow(principal, permissionKernel.scopeOf(principal), dto);
            return toDto(saved, employeeLookupService.require(saved.getEmployeeId()));
        });
    }

    /**
     * 한 행 생성. 호출 측 트랜잭션 안에서 실행된다.
     */
    Schedule createRow(EssPrincipal principal, Scope scope, ScheduleCreateRequestDto dto) {
        if (dto.getEmployeeId() == null || dto.getScheduleDate() == null
                || (dto.getShiftTemplateId() == null && (dto.getShiftStart() == null || dto.getShiftEnd() == null))) {
            throw EssException.validation("Employee, date, shift start and end times are required");
        }
        Employee employee = requireManagedEmployee(principal, scope, dto.getEmployeeId(), dto.getScheduleDate());
        if (scheduleRepository.existsByEmployeeIdAndScheduleDate(employee.getId(), dto.getScheduleDate())) {
            throw EssException.conflict("Schedule already exists for this employee on this date");
        }

        Schedule schedule = Schedule.builder()
                .employeeId(employee.getId())
                .companyId(employee.getCompanyId())
                .outletId(employee.getOutletId())
                .departmentId(employee.getDepartmentId())
                .scheduleDate(dto.getScheduleDate())
                .createdBy(principal.getId())
                .build();
        applyShift(schedule, dto.getShiftTemplateId(), dto.getShiftStart(), dto.getShiftEnd(), dto.getBreakDuration());
        schedule.setPublicHoliday(isPublicHoliday(employee.getCompanyId(), dto.getScheduleDate()));

        Schedule saved = scheduleRepository.save(schedule);
        clockInService.syncSchedule(employee.getId(), saved.getScheduleDate(), saved);
        log.info("스케줄 생성 - employee: {}, date: {}, by: {}", employee.getEmployeeCode(), saved.getScheduleDate(), principal.getLoginId());
        return saved;
    }

    public ScheduleResponseDto update(EssPrincipal principal, Long scheduleId, ScheduleCreateRequestDto dto) {
        permissionKernel.requireCapability(principal, Capability.MANAGE_SCHEDULE);
        return transactionRunner.inSerializable("update schedule", () -> {
            Schedule schedule = scheduleRepository.findWithLockById(scheduleId)
                    .orElseThrow(() -> EssException.notFound("Schedule"));
            Employee employee = requireManagedEmployee(principal, permissionKernel.scopeOf(principal),
                    schedule.getEmployeeId(), schedule.getScheduleDate());
            applyShift(schedule,
                    dto.getShiftTemplateId() != null ? dto.getShiftTemplateId() : schedule.getShiftTemplateId(),
                    dto.getShiftStart() != null ? dto.getShiftStart() : schedule.getShiftStart(),
                    dto.getShiftEnd() != null ? dto.getShiftEnd() : schedule.getShiftEnd(),
                    dto.getBreakDuration() != null ? dto.getBreakDuration() : schedule.getBreakDuration());
            Schedule saved = scheduleRepository.save(schedule);
            clockInService.syncSchedule(employee.getId(), saved.getScheduleDate(), saved);
            log.info("스케줄 수정 - id: {}, by: {}", scheduleId, principal.getLoginId());
            return toDto(saved, employee);
        });
    }

    public void delete(EssPrincipal principal, Long scheduleId) {
        permissionKernel.requireCapability(principal, Capability.MANAGE_SCHEDULE);
        transactionRunner.runSerializable("delete schedule", () -> {
            Schedule schedule = scheduleRepository.findWithLockById(scheduleId)
                    .orElseThrow(() -> EssException.notFound("Schedule"));
            requireManagedEmployee(principal, permissionKernel.scopeOf(principal), schedule.getEmployeeId(), schedule.getScheduleDate());
            scheduleRepository.delete(schedule);
            clockInService.syncSchedule(schedule.getEmployeeId(), schedule.getScheduleDate(), null);
            log.info("스케줄 삭제 - id: {}, by: {}", scheduleId, principal.getLoginId());
        });
    }

    /**
     * 템플릿 배정. 해당 일자 행이 있으면 교체한다.
     */
    public ScheduleResponseDto assign(EssPrincipal principal, ScheduleAssignRequestDto dto) {
        permissionKernel.requireCapability(principal, Capability.MANAGE_SCHEDULE);
        return transactionRunner.inSerializable("assign shift", () -> {
            Schedule saved = assignRow(principal, permissionKernel.scopeOf(principal), dto);
            return toDto(saved, employeeLookupService.require(saved.getEmployeeId()));
        });
    }

    Schedule assignRow(EssPrincipal principal, Scope scope, ScheduleAssignRequestDto dto) {
        Employee employee = requireManagedEmployee(principal, scope, dto.getEmployeeId(), dto.getScheduleDate());
        Schedule schedule = scheduleRepository.findByEmployeeIdAndScheduleDate(employee.getId(), dto.getScheduleDate())
                .orElseGet(() -> Schedule.builder()
                        .employeeId(employee.getId())
                        .companyId(employee.getCompanyId())
                        .outletId(employee.getOutletId())
                        .departmentId(employee.getDepartmentId())
                        .scheduleDate(dto.getScheduleDate())
                        .createdBy(principal.getId())
                        .build());
        applyShift(schedule, dto.getShiftTemplateId(), null, null, null);
        schedule.setPublicHoliday(isPublicHoliday(employee.getCompanyId(), dto.getScheduleDate()));
        Schedule saved = scheduleRepository.save(schedule);
        clockInService.syncSchedule(employee.getId(), saved.getScheduleDate(), saved);
        return saved;
    }

    /**
     * 기간 내 지정 요일에 생성. 이미 있는 날짜는 건너뛰고 행 단위 오류는 모아서 돌려준다.
     */
    public BulkScheduleResultDto bulkCreate(EssPrincipal principal, ScheduleBulkCreateRequestDto dto) {
        permissionKernel.requireCapability(principal, Capability.MANAGE_SCHEDULE);
        if (dto.getEndDate().isBefore(dto.getStartDate())) {
            throw EssException.validation("End date cannot be before start date");
        }
        Scope scope = permissionKernel.scopeOf(principal);
        BulkScheduleResultDto result = new BulkScheduleResultDto();

        List<LocalDate> dates = dto.getStartDate().datesUntil(dto.getEndDate().plusDays(1))
                .filter(d -> dto.getDaysOfWeek().contains(d.getDayOfWeek()))
                .toList();
        if (dates.isEmpty()) {
            throw EssException.validation("No matching dates found in the specified range");
        }

        for (LocalDate date : dates) {
            if (scheduleRepository.existsByEmployeeIdAndScheduleDate(dto.getEmployeeId(), date)) {
                result.setSkipped(result.getSkipped() + 1);
                continue;
            }
            ScheduleCreateRequestDto row = new ScheduleCreateRequestDto();
            row.setEmployeeId(dto.getEmployeeId());
            row.setScheduleDate(date);
            row.setShiftTemplateId(dto.getShiftTemplateId());
            row.setShiftStart(dto.getShiftStart());
            row.setShiftEnd(dto.getShiftEnd());
            row.setBreakDuration(dto.getBreakDuration());
            try {
                transactionRunner.inSerializable("bulk create schedule", () -> createRow(principal, scope, row));
                result.setCreated(result.getCreated() + 1);
            } catch (EssException e) {
                result.addError(dto.getEmployeeId(), date, e.getMessage());
            }
        }
        log.info("스케줄 일괄 생성 - employee: {}, created: {}, skipped: {}, errors: {}", dto.getEmployeeId(),
                result.getCreated(), result.getSkipped(), result.getErrors().size());
        return result;
    }

    public BulkScheduleResultDto bulkAssign(EssPrincipal principal, ScheduleBulkAssignRequestDto dto) {
        permissionKernel.requireCapability(principal, Capability.MANAGE_SCHEDULE);
        Scope scope = permissionKernel.scopeOf(principal);
        BulkScheduleResultDto result = new BulkScheduleResultDto();
        for (ScheduleAssignRequestDto row : dto.getAssignments()) {
            try {
                transactionRunner.inSerializable("bulk assign shift", () -> assignRow(principal, scope, row));
                result.setCreated(result.getCreated() + 1);
            } catch (EssException e) {
                result.addError(row.getEmployeeId(), row.getScheduleDate(), e.getMessage());
            }
        }
        log.info("스케줄 일괄 배정 - by: {}, assigned: {}, errors: {}", principal.getLoginId(),
                result.getCreated(), result.getErrors().size());
        return result;
    }

    public ScheduleEditPermissionDto editPermission(EssPrincipal principal) {
        return editPolicy.view(principal);
    }

    @Transactional(readOnly = true)
    public List<ScheduleResponseDto> mySchedules(EssPrincipal principal, LocalDate from, LocalDate to) {
        Employee employee = employeeLookupService.requireSelf(principal);
        LocalDate start = from != null ? from : editPolicy.today().withDayOfMonth(1);
        LocalDate end = to != null ? to : start.plusMonths(1).minusDays(1);
        Map<Long, ShiftTemplate> templates = templatesById(employee.getCompanyId());
        return scheduleRepository.findByEmployeeIdAndScheduleDateBetweenOrderByScheduleDate(employee.getId(), start, end).stream()
                .map(s -> ScheduleResponseDto.fromEntity(s, resolveTemplate(s, templates), employee.getName()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ShiftTemplateResponseDto> templates(EssPrincipal principal) {
        Long companyId = requireCompanyContext(principal);
        return shiftTemplateRepository.findByCompanyIdAndActiveTrue(companyId).stream()
                .map(ShiftTemplateResponseDto::fromEntity)
                .toList();
    }

    @Transactional(readOnly = true)
    public WeeklyRosterDto weeklyRoster(EssPrincipal principal, Long outletId, Long departmentId, LocalDate weekStart) {
        UnitWeek unit = loadUnitWeek(principal, outletId, departmentId, weekStart);
        Map<Long, ShiftTemplate> templates = templatesById(principal.getCompanyId());

        Map<Long, Map<LocalDate, ScheduleResponseDto>> byEmployee = new LinkedHashMap<>();
        for (Schedule schedule : unit.schedules) {
            byEmployee.computeIfAbsent(schedule.getEmployeeId(), k -> new LinkedHashMap<>())
                    .put(schedule.getScheduleDate(), ScheduleResponseDto.fromEntity(schedule, resolveTemplate(schedule, templates), null));
        }
        List<WeeklyRosterDto.Row> rows = new ArrayList<>();
        for (Employee employee : unit.employees) {
            rows.add(WeeklyRosterDto.Row.builder()
                    .employeeId(employee.getId())
                    .employeeName(employee.getName())
                    .employeeCode(employee.getEmployeeCode())
                    .shifts(byEmployee.getOrDefault(employee.getId(), Map.of()))
                    .build());
        }
        return WeeklyRosterDto.builder()
                .weekStart(weekStart)
                .weekEnd(weekStart.plusDays(WeeklyScheduleValidator.DAYS_IN_WEEK - 1))
                .outletId(outletId)
                .departmentId(departmentId)
                .days(weekStart.datesUntil(weekStart.plusDays(WeeklyScheduleValidator.DAYS_IN_WEEK)).toList())
                .rows(rows)
                .build();
    }

    @Transactional(readOnly = true)
    public List<WeeklyValidationDto> validateWeek(EssPrincipal principal, Long outletId, Long departmentId, LocalDate weekStart) {
        UnitWeek unit = loadUnitWeek(principal, outletId, departmentId, weekStart);
        return WeeklyScheduleValidator.validate(weekStart, unit.employees, unit.schedules);
    }

    private UnitWeek loadUnitWeek(EssPrincipal principal, Long outletId, Long departmentId, LocalDate weekStart) {
        permissionKernel.requireCapability(principal, Capability.VIEW_TEAM);
        if (weekStart == null || (outletId == null && departmentId == null)) {
            throw EssException.validation("Outlet or department and start_date are required");
        }
        Scope scope = permissionKernel.scopeOf(principal);
        if (!scope.coversUnit(outletId, departmentId)) {
            throw EssException.forbidden(outletId != null
                    ? "You do not have access to this outlet"
                    : "You do not have access to this department");
        }
        LocalDate weekEnd = weekStart.plusDays(WeeklyScheduleValidator.DAYS_IN_WEEK - 1);
        List<Employee> employees = outletId != null
                ? employeeRepository.findByOutletIdAndStatus(outletId, EmployeeStatus.ACTIVE)
                : employeeRepository.findByDepartmentIdAndStatus(departmentId, EmployeeStatus.ACTIVE);
        employees = employees.stream().filter(e -> scope.sharesCompany(e.getCompanyId())).toList();
        List<Schedule> schedules = outletId != null
                ? scheduleRepository.findByOutletIdAndScheduleDateBetween(outletId, weekStart, weekEnd)
                : scheduleRepository.findByDepartmentIdAndScheduleDateBetween(departmentId, weekStart, weekEnd);
        return new UnitWeek(employees, schedules);
    }

    /**
     * 편집 대상 직원 검증: 관리 범위, 재직 상태, 마지막 근무일, T+2
     */
    private Employee requireManagedEmployee(EssPrincipal principal, Scope scope, Long employeeId, LocalDate date) {
        Employee employee = employeeLookupService.require(employeeId);
        permissionKernel.requireScope(principal, scope, employee);
        if (employee.getStatus() == EmployeeStatus.RESIGNED) {
            throw EssException.validation("Cannot create schedules for resigned employees");
        }
        if (employee.getLastWorkingDay() != null && date != null && date.isAfter(employee.getLastWorkingDay())) {
            throw EssException.validation("Cannot create schedules after employee's last working day ("
                    + employee.getLastWorkingDay() + ")");
        }
        editPolicy.check(principal, date);
        return employee;
    }

    private void applyShift(Schedule schedule, Long templateId, LocalTime start, LocalTime end, Integer breakDuration) {
        if (templateId != null) {
            ShiftTemplate template = shiftTemplateRepository.findById(templateId)
                    .filter(t -> t.getCompanyId().equals(schedule.getCompanyId()))
                    .orElseThrow(() -> EssException.notFound("Shift template"));
            schedule.setShiftTemplateId(template.getId());
            if (template.isOffTemplate()) {
                schedule.setStatus(ScheduleStatus.OFF);
                schedule.setShiftStart(null);
                schedule.setShiftEnd(null);
                schedule.setBreakDuration(0);
                return;
            }
            schedule.setStatus(ScheduleStatus.SCHEDULED);
            schedule.setShiftStart(template.getStartTime());
            schedule.setShiftEnd(template.getEndTime());
            schedule.setBreakDuration(template.getBreakDuration() != null ? template.getBreakDuration() : policy.getDefaultBreakMinutes());
            return;
        }
        schedule.setShiftTemplateId(null);
        schedule.setStatus(ScheduleStatus.SCHEDULED);
        schedule.setShiftStart(start);
        schedule.setShiftEnd(end);
        schedule.setBreakDuration(breakDuration != null ? breakDuration : policy.getDefaultBreakMinutes());
    }

    private boolean isPublicHoliday(Long companyId, LocalDate date) {
        return !publicHolidayRepository.findApplicable(companyId, date, date).isEmpty();
    }

    private Map<Long, ShiftTemplate> templatesById(Long companyId) {
        if (companyId == null) {
            return Map.of();
        }
        return shiftTemplateRepository.findByCompanyIdAndActiveTrue(companyId).stream()
                .collect(Collectors.toMap(ShiftTemplate::getId, Function.identity()));
    }

    /**
     * 템플릿 id 가 없으면 (회사, 시작, 종료) 로 맞춰 본다. 표시용.
     */
    ShiftTemplate resolveTemplate(Schedule schedule, Map<Long, ShiftTemplate> templates) {
        if (schedule.getShiftTemplateId() != null) {
            ShiftTemplate template = templates.get(schedule.getShiftTemplateId());
            if (template != null) {
                return template;
            }
            return shiftTemplateRepository.findById(schedule.getShiftTemplateId()).orElse(null);
        }
        if (schedule.getShiftStart() == null || schedule.getShiftEnd() == null) {
            return null;
        }
        return shiftTemplateRepository.findFirstByCompanyIdAndStartTimeAndEndTime(
                schedule.getCompanyId(), schedule.getShiftStart(), schedule.getShiftEnd()).orElse(null);
    }

    private ScheduleResponseDto toDto(Schedule schedule, Employee employee) {
        return ScheduleResponseDto.fromEntity(schedule, resolveTemplate(schedule, Map.of()), employee.getName());
    }

    private static Long requireCompanyContext(EssPrincipal principal) {
        if (principal.getCompanyId() == null) {
            throw EssException.validation("Select a company context first");
        }
        return principal.getCompanyId();
    }

    private static class UnitWeek {
        private final List<Employee> employees;
        private final List<Schedule> schedules;

        UnitWeek(List<Employee> employees, List<Schedule> schedules) {
            this.employees = employees;
            this.schedules = schedules;
        }
    }
}
