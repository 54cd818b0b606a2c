package hrms.hrmsbackend.service.attendance;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.request.attendance.ClockActionRequestDto;
import hrms.hrmsbackend.dto.response.attendance.AttendanceHistoryResponseDto;
import hrms.hrmsbackend.dto.response.attendance.ClockInRecordResponseDto;
import hrms.hrmsbackend.dto.response.attendance.ClockStatusResponseDto;
import hrms.hrmsbackend.entity.mysql.attendance.ClockInRecord;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.PublicHoliday;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.enums.OtDayType;
import hrms.hrmsbackend.enums.PunchAction;
import hrms.hrmsbackend.exception.ErrorKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.attendance.ClockInRecordRepository;
import hrms.hrmsbackend.repository.mysql.schedule.PublicHolidayRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ScheduleRepository;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.ScopeResolver;
import hrms.hrmsbackend.util.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 출퇴근 기록. 시간 제한 없이 기록하고 스케줄 여부만 표시한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClockInService {

    private final ClockInRecordRepository clockInRecordRepository;
    private final ScheduleRepository scheduleRepository;
    private final PublicHolidayRepository publicHolidayRepository;
    private final EmployeeLookupService employeeLookupService;
    private final ScopeResolver scopeResolver;
    private final TransactionRunner transactionRunner;
    private final EssPolicyProperties policy;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ClockStatusResponseDto status(EssPrincipal principal) {
        Employee employee = employeeLookupService.requireSelf(principal);
        LocalDate today = LocalDate.now(clock);
        ClockInRecord record = clockInRecordRepository.findByEmployeeIdAndWorkDate(employee.getId(), today).orElse(null);
        PunchAction next = PunchProtocol.nextAction(record);
        return ClockStatusResponseDto.builder()
                .workDate(today)
                .status(PunchProtocol.status(record))
                .nextAction(next != null ? next.getValue() : null)
                .clockInRequired(!Boolean.FALSE.equals(employee.getClockInRequired()))
                .record(record != null ? ClockInRecordResponseDto.fromEntity(record, employee) : null)
                .build();
    }

    public ClockInRecordResponseDto punch(EssPrincipal principal, ClockActionRequestDto dto) {
        PunchAction action;
        try {
            action = PunchAction.fromValue(dto.getAction());
        } catch (IllegalArgumentException e) {
            throw EssException.validation("Invalid action. Must be one of: clock_in_1, clock_out_1, clock_in_2, clock_out_2");
        }

        return transactionRunner.inSerializable("clock " + action.getValue(), () -> {
            Employee employee = employeeLookupService.requireSelf(principal);
            if (Boolean.FALSE.equals(employee.getClockInRequired())) {
                throw EssException.validation("Clock-in is not required for your account");
            }
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDate today = now.toLocalDate();

            ClockInRecord record = clockInRecordRepository.findForUpdate(employee.getId(), today).orElse(null);
            PunchProtocol.validate(record, action, dto.getPhoto(), dto.getLatitude(), dto.getLongitude());

            if (record == null) {
                record = newRecord(employee, today);
            }
            PunchProtocol.apply(record, action, now, dto.getPhoto(), PunchProtocol.formatLocation(dto.getLatitude(), dto.getLongitude()));
            recalculate(record, employee);

            try {
                ClockInRecord saved = clockInRecordRepository.saveAndFlush(record);
                log.info("출퇴근 기록 - employee: {}, action: {}, date: {}", employee.getEmployeeCode(), action.getValue(), today);
                return ClockInRecordResponseDto.fromEntity(saved, employee);
            } catch (DataIntegrityViolationException e) {
                // 같은 날 첫 출근이 동시에 들어온 경우
                log.warn("출근 기록 중복 - employee: {}, date: {}", employee.getEmployeeCode(), today);
                throw new EssException(ErrorKind.CONFLICT, "You have already clocked in for today", e);
            }
        });
    }

    private ClockInRecord newRecord(Employee employee, LocalDate workDate) {
        ClockInRecord record = new ClockInRecord();
        record.setEmployeeId(employee.getId());
        record.setCompanyId(employee.getCompanyId());
        record.setOutletId(employee.getOutletId());
        record.setDepartmentId(employee.getDepartmentId());
        record.setWorkDate(workDate);

        Optional<Schedule> schedule = scheduleRepository.findByEmployeeIdAndScheduleDate(employee.getId(), workDate);
        record.setHasSchedule(schedule.isPresent() && schedule.get().isWorkingShift());
        record.setScheduleId(schedule.map(Schedule::getId).orElse(null));
        return record;
    }

    /**
     * 근무/휴게/OT 재계산. 파트타임은 OT 대상이 아니다.
     */
    void recalculate(ClockInRecord record, Employee employee) {
        WorkTimeCalculator.WorkTime workTime = WorkTimeCalculator.calculate(record);
        record.setTotalWorkMinutes(workTime.getWorkMinutes());
        record.setTotalBreakMinutes(workTime.getBreakMinutes());

        if (record.getClockOut2() == null || employee.isPartTime()) {
            record.setOtMinutes(0);
            record.setOtFlagged(false);
            return;
        }

        Company company = scopeResolver.requireCompany(employee.getCompanyId());
        Schedule schedule = record.getScheduleId() != null
                ? scheduleRepository.findById(record.getScheduleId()).orElse(null)
                : null;
        int baseline = OvertimeCalculator.baselineMinutes(schedule, company, policy.getStandardWorkMinutes());
        int otMinutes = OvertimeCalculator.overtimeMinutes(workTime.getWorkMinutes(), baseline, company);

        Set<LocalDate> holidays = publicHolidayRepository
                .findApplicable(company.getId(), record.getWorkDate(), record.getWorkDate()).stream()
                .map(PublicHoliday::getDate)
                .collect(Collectors.toSet());
        OtDayType dayType = OvertimeCalculator.dayType(record.getWorkDate(), holidays);

        record.setOtMinutes(otMinutes);
        record.setOtFlagged(otMinutes >= policy.getOtFlagMinutes());
        record.setOtDayType(dayType);
        record.setOtMultiplier(OvertimeCalculator.multiplier(company, dayType));
    }

    @Transactional(readOnly = true)
    public AttendanceHistoryResponseDto history(EssPrincipal principal, LocalDate from, LocalDate to) {
        Employee employee = employeeLookupService.requireSelf(principal);
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.withDayOfMonth(1);
        if (end.isBefore(start)) {
            throw EssException.validation("End date cannot be before start date");
        }

        List<ClockInRecord> records = clockInRecordRepository
                .findByEmployeeIdAndWorkDateBetweenOrderByWorkDateDesc(employee.getId(), start, end);
        int totalMinutes = records.stream().mapToInt(r -> r.getTotalWorkMinutes() != null ? r.getTotalWorkMinutes() : 0).sum();
        int otMinutes = records.stream().mapToInt(r -> r.getOtMinutes() != null ? r.getOtMinutes() : 0).sum();
        int pending = (int) records.stream().filter(r -> r.getClockIn1() != null && r.getClockOut2() == null).count();

        return AttendanceHistoryResponseDto.builder()
                .records(records.stream().map(r -> ClockInRecordResponseDto.fromEntity(r, employee)).toList())
                .totalDays(records.size())
                .totalHours(OvertimeCalculator.formatHours(totalMinutes))
                .totalOtHours(OvertimeCalculator.formatHours(otMinutes))
                .pendingCompletion(pending)
                .build();
    }

    /**
     * 출근 이후에 스케줄이 생성/삭제되면 표시값을 다시 맞춘다. 호출 측 트랜잭션에서 실행.
     */
    public void syncSchedule(Long employeeId, LocalDate workDate, Schedule schedule) {
        clockInRecordRepository.findByEmployeeIdAndWorkDate(employeeId, workDate).ifPresent(record -> {
            record.setHasSchedule(schedule != null && schedule.isWorkingShift());
            record.setScheduleId(schedule != null ? schedule.getId() : null);
            clockInRecordRepository.save(record);
        });
    }
}
