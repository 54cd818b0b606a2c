package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveBalance;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.exception.ErrorKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveBalanceRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveTypeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LeaveBalanceService 단위 테스트")
class LeaveBalanceServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kuala_Lumpur");

    @Mock
    private LeaveBalanceRepository leaveBalanceRepository;
    @Mock
    private LeaveTypeRepository leaveTypeRepository;
    @Mock
    private EmployeeRepository employeeRepository;

    private LeaveBalanceService leaveBalanceService;

    private final Employee employee = Employee.builder().id(20L).employeeCode("S020").companyId(1L)
            .joinDate(LocalDate.of(2021, 3, 1)).build();
    private final LeaveType annual = LeaveType.builder().id(3L).code("AL").name("Annual Leave")
            .defaultDaysPerYear(12.0).carriesForward(true).maxCarryForward(4.0).build();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(ZonedDateTime.of(2025, 6, 2, 9, 0, 0, 0, ZONE).toInstant(), ZONE);
        leaveBalanceService = new LeaveBalanceService(leaveBalanceRepository, leaveTypeRepository, employeeRepository, clock);
    }

    private static LeaveBalance balance(double entitled, double carried, double used) {
        return LeaveBalance.builder().employeeId(20L).leaveTypeId(3L).year(2025)
                .entitledDays(entitled).carriedForward(carried).usedDays(used).build();
    }

    private static LeaveRequest request(double days) {
        LeaveRequest request = new LeaveRequest();
        request.setId(100L);
        request.setEmployeeId(20L);
        request.setLeaveTypeId(3L);
        request.setStartDate(LocalDate.of(2025, 6, 10));
        request.setTotalDays(days);
        return request;
    }

    @Test
    @DisplayName("잔여 행이 없으면 부여 일수로 새로 만든다")
    void ensureBalanceCreates() {
        when(leaveBalanceRepository.saveAndFlush(any(LeaveBalance.class))).thenAnswer(inv -> inv.getArgument(0));

        LeaveBalance created = leaveBalanceService.ensureBalance(employee, annual, 2025);

        assertThat(created.getEntitledDays()).isEqualTo(12.0);
        assertThat(created.getUsedDays()).isZero();
        assertThat(created.getYear()).isEqualTo(2025);
    }

    @Test
    @DisplayName("동시 초기화로 유니크 충돌이 나면 Conflict")
    void ensureBalanceRace() {
        when(leaveBalanceRepository.saveAndFlush(any(LeaveBalance.class)))
                .thenThrow(new DataIntegrityViolationException("uk_leave_balance"));

        assertThatThrownBy(() -> leaveBalanceService.ensureBalance(employee, annual, 2025))
                .isInstanceOf(EssException.class)
                .extracting(e -> ((EssException) e).getKind())
                .isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    @DisplayName("차감은 잔여가 충분할 때만 사용 일수를 올린다")
    void debit() {
        LeaveBalance locked = balance(12.0, 1.0, 10.0);
        when(leaveBalanceRepository.findForUpdate(20L, 3L, 2025)).thenReturn(Optional.of(locked));
        when(leaveBalanceRepository.save(locked)).thenReturn(locked);

        leaveBalanceService.debit(request(3.0));
        assertThat(locked.getUsedDays()).isEqualTo(13.0);

        assertThatThrownBy(() -> leaveBalanceService.debit(request(0.5)))
                .isInstanceOf(EssException.class)
                .hasMessage("Insufficient leave balance. Available: 0 days, Requested: 0.5 days");
    }

    @Test
    @DisplayName("복원으로 음수가 되면 내부 오류")
    void creditNeverNegative() {
        LeaveBalance locked = balance(12.0, 0.0, 1.0);
        when(leaveBalanceRepository.findForUpdate(20L, 3L, 2025)).thenReturn(Optional.of(locked));

        assertThatThrownBy(() -> leaveBalanceService.credit(request(2.0)))
                .isInstanceOf(EssException.class)
                .extracting(e -> ((EssException) e).getKind())
                .isEqualTo(ErrorKind.INTERNAL);
        verify(leaveBalanceRepository, never()).save(any());
    }

    @Test
    @DisplayName("잠금 대상 행이 없으면 만들고 다시 잠근다")
    void lockCreatesMissingRow() {
        LeaveBalance created = balance(12.0, 0.0, 0.0);
        when(leaveBalanceRepository.findForUpdate(20L, 3L, 2025))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(created));
        when(employeeRepository.findById(20L)).thenReturn(Optional.of(employee));
        when(leaveTypeRepository.findById(3L)).thenReturn(Optional.of(annual));
        when(leaveBalanceRepository.saveAndFlush(any(LeaveBalance.class))).thenAnswer(inv -> inv.getArgument(0));
        when(leaveBalanceRepository.save(created)).thenReturn(created);

        leaveBalanceService.debit(request(2.0));

        assertThat(created.getUsedDays()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("연도 초기화는 회사와 휴가 종류가 모두 허용할 때만 최대치까지 이월한다")
    void initializeYearCarriesForward() {
        Company company = Company.builder().id(1L).leaveCarryForwardEnabled(true).build();
        LeaveType medical = LeaveType.builder().id(4L).code("SL").defaultDaysPerYear(14.0).carriesForward(false).build();
        when(employeeRepository.findByCompanyIdAndStatus(1L, EmployeeStatus.ACTIVE)).thenReturn(List.of(employee));
        when(leaveTypeRepository.findAvailableForCompany(1L)).thenReturn(List.of(annual, medical));
        when(leaveBalanceRepository.findByEmployeeIdAndLeaveTypeIdAndYear(20L, 3L, 2024))
                .thenReturn(Optional.of(LeaveBalance.builder().entitledDays(12.0).carriedForward(0.0).usedDays(5.0).build()));

        LeaveBalanceService.YearInitResult result = leaveBalanceService.initializeYear(company, 2025);

        assertThat(result.getCreated()).isEqualTo(2);
        assertThat(result.getSkipped()).isZero();
        ArgumentCaptor<LeaveBalance> saved = ArgumentCaptor.forClass(LeaveBalance.class);
        verify(leaveBalanceRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues())
                .extracting(LeaveBalance::getLeaveTypeId, LeaveBalance::getCarriedForward)
                .containsExactly(tuple(3L, 4.0), tuple(4L, 0.0));
    }
}
