package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveBalance;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveBalanceRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveTypeRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 휴가 잔여 관리. used_days 는 승인/되돌림/승인 건 취소 경로에서만 바뀐다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaveBalanceService {

    private final LeaveBalanceRepository leaveBalanceRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final EmployeeRepository employeeRepository;
    private final Clock clock;

    /**
     * 잔여 행이 없으면 부여 일수를 계산해서 생성한다 (조회와 신청이 같은 경로 사용)
     */
    public LeaveBalance ensureBalance(Employee employee, LeaveType type, int year) {
        Optional<LeaveBalance> existing = leaveBalanceRepository
                .findByEmployeeIdAndLeaveTypeIdAndYear(employee.getId(), type.getId(), year);
        if (existing.isPresent()) {
            return existing.get();
        }
        double entitled = EntitlementCalculator.entitledDays(type, employee.getJoinDate(), entitlementDate(year));
        LeaveBalance balance = LeaveBalance.builder()
                .employeeId(employee.getId())
                .leaveTypeId(type.getId())
                .year(year)
                .entitledDays(entitled)
                .carriedForward(0.0)
                .usedDays(0.0)
                .build();
        try {
            LeaveBalance saved = leaveBalanceRepository.saveAndFlush(balance);
            log.info("휴가 잔여 초기화 - employee: {}, type: {}, year: {}, entitled: {}",
                    employee.getEmployeeCode(), type.getCode(), year, entitled);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw EssException.conflict("Leave balance is being initialized by another request. Please retry.");
        }
    }

    /**
     * 승인 시 차감. 차감 후 사용 일수가 총 일수를 넘으면 거부.
     */
    public LeaveBalance debit(LeaveRequest request) {
        LeaveBalance balance = lockBalance(request);
        double days = request.getTotalDays();
        if (balance.getAvailableDays() < days) {
            throw EssException.validation(insufficientMessage(balance.getAvailableDays(), days));
        }
        balance.setUsedDays(nz(balance.getUsedDays()) + days);
        log.info("휴가 차감 - request: {}, days: {}, used: {}", request.getId(), days, balance.getUsedDays());
        return leaveBalanceRepository.save(balance);
    }

    /**
     * 승인 취소/되돌림 시 차감분 복원 (차감과 정확히 대칭)
     */
    public LeaveBalance credit(LeaveRequest request) {
        LeaveBalance balance = lockBalance(request);
        double days = request.getTotalDays();
        double used = nz(balance.getUsedDays()) - days;
        if (used < 0) {
            throw EssException.internal("Leave balance would become negative for request " + request.getId());
        }
        balance.setUsedDays(used);
        log.info("휴가 복원 - request: {}, days: {}, used: {}", request.getId(), days, used);
        return leaveBalanceRepository.save(balance);
    }

    private LeaveBalance lockBalance(LeaveRequest request) {
        int year = request.getBalanceYear() != null ? request.getBalanceYear() : request.getStartDate().getYear();
        Optional<LeaveBalance> locked = leaveBalanceRepository
                .findForUpdate(request.getEmployeeId(), request.getLeaveTypeId(), year);
        if (locked.isPresent()) {
            return locked.get();
        }
        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> EssException.notFound("Employee"));
        LeaveType type = leaveTypeRepository.findById(request.getLeaveTypeId())
                .orElseThrow(() -> EssException.notFound("Leave type"));
        ensureBalance(employee, type, year);
        return leaveBalanceRepository.findForUpdate(request.getEmployeeId(), request.getLeaveTypeId(), year)
                .orElseThrow(() -> EssException.internal("Leave balance missing after initialization"));
    }

    /**
     * 연도 초기화. 회사와 휴가 종류 모두 이월을 허용하면 전년도 잔여를 최대치까지 이월한다.
     */
    public YearInitResult initializeYear(Company company, int year) {
        List<Employee> employees = employeeRepository.findByCompanyIdAndStatus(company.getId(), EmployeeStatus.ACTIVE);
        List<LeaveType> types = leaveTypeRepository.findAvailableForCompany(company.getId());
        int created = 0;
        int skipped = 0;

        for (Employee employee : employees) {
            for (LeaveType type : types) {
                if (leaveBalanceRepository.findByEmployeeIdAndLeaveTypeIdAndYear(employee.getId(), type.getId(), year).isPresent()) {
                    skipped++;
                    continue;
                }
                double entitled = EntitlementCalculator.entitledDays(type, employee.getJoinDate(), LocalDate.of(year, 1, 1));
                double carried = 0.0;
                if (Boolean.TRUE.equals(company.getLeaveCarryForwardEnabled()) && Boolean.TRUE.equals(type.getCarriesForward())) {
                    double max = type.getMaxCarryForward() != null
                            ? type.getMaxCarryForward()
                            : nz(company.getLeaveCarryForwardMaxDays());
                    carried = leaveBalanceRepository
                            .findByEmployeeIdAndLeaveTypeIdAndYear(employee.getId(), type.getId(), year - 1)
                            .map(prev -> EntitlementCalculator.carryForward(nz(prev.getEntitledDays()),
                                    nz(prev.getCarriedForward()), nz(prev.getUsedDays()), max))
                            .orElse(0.0);
                }
                leaveBalanceRepository.save(LeaveBalance.builder()
                        .employeeId(employee.getId())
                        .leaveTypeId(type.getId())
                        .year(year)
                        .entitledDays(entitled)
                        .carriedForward(carried)
                        .usedDays(0.0)
                        .build());
                created++;
            }
        }
        log.info("{}년 휴가 잔여 초기화 완료 - company: {}, 생성: {}, 기존: {}", year, company.getId(), created, skipped);
        return new YearInitResult(year, created, skipped);
    }

    // 당해 연도는 오늘, 지난 연도는 연말, 다음 연도는 연초 기준으로 근속 연수 계산
    private LocalDate entitlementDate(int year) {
        LocalDate today = LocalDate.now(clock);
        if (year < today.getYear()) {
            return LocalDate.of(year, 12, 31);
        }
        if (year > today.getYear()) {
            return LocalDate.of(year, 1, 1);
        }
        return today;
    }

    public static String insufficientMessage(double available, double requested) {
        return "Insufficient leave balance. Available: " + formatDays(available)
                + " days, Requested: " + formatDays(requested) + " days";
    }

    public static String formatDays(double days) {
        if (days == Math.rint(days)) {
            return String.valueOf((long) days);
        }
        return String.valueOf(days);
    }

    private static double nz(Double value) {
        return value != null ? value : 0.0;
    }

    @Getter
    @AllArgsConstructor
    public static class YearInitResult {
        private final int year;
        private final int created;
        private final int skipped;
    }
}
