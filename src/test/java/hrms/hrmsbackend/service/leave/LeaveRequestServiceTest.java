package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.request.leave.LeaveApplyRequestDto;
import hrms.hrmsbackend.dto.response.leave.LeaveRequestResponseDto;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveBalance;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.GroupingType;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.enums.Role;
import hrms.hrmsbackend.exception.ErrorKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.leave.LeaveRequestRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveTypeRepository;
import hrms.hrmsbackend.repository.mysql.schedule.PublicHolidayRepository;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.service.permission.ScopeResolver;
import hrms.hrmsbackend.util.TransactionRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LeaveRequestService 단위 테스트")
class LeaveRequestServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kuala_Lumpur");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 2);

    @Mock
    private LeaveRequestRepository leaveRequestRepository;
    @Mock
    private LeaveTypeRepository leaveTypeRepository;
    @Mock
    private PublicHolidayRepository publicHolidayRepository;
    @Mock
    private LeaveBalanceService leaveBalanceService;
    @Mock
    private LeaveRequestKind leaveRequestKind;
    @Mock
    private RequestLifecycleService lifecycle;
    @Mock
    private PermissionKernel permissionKernel;
    @Mock
    private ScopeResolver scopeResolver;
    @Mock
    private EmployeeLookupService employeeLookupService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private LeaveRequestService leaveRequestService;

    private final Company company = Company.builder().id(1L).groupingType(GroupingType.OUTLET).build();
    private final Employee employee = Employee.builder().id(20L).name("Siti").companyId(1L).outletId(7L)
            .employeeRole(EmployeeRole.STAFF).joinDate(LocalDate.of(2020, 1, 1)).build();
    private final EssPrincipal principal = EssPrincipal.builder().id(20L).loginId("S020").companyId(1L)
            .role(Role.EMPLOYEE).employeeRole(EmployeeRole.STAFF).outletId(7L).build();
    private final LeaveType annual = LeaveType.builder().id(3L).code("AL").name("Annual Leave").paid(true).build();
    private final LeaveType medical = LeaveType.builder().id(4L).code("SL").name("Medical Leave")
            .paid(true).requiresAttachment(true).build();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(ZonedDateTime.of(2025, 6, 2, 9, 0, 0, 0, ZONE).toInstant(), ZONE);
        leaveRequestService = new LeaveRequestService(leaveRequestRepository, leaveTypeRepository, publicHolidayRepository,
                leaveBalanceService, leaveRequestKind, lifecycle, permissionKernel, scopeResolver, employeeLookupService,
                new TransactionRunner(transactionManager), new EssPolicyProperties(), clock);

        when(employeeLookupService.requireSelf(principal)).thenReturn(employee);
        when(employeeLookupService.require(20L)).thenReturn(employee);
        when(scopeResolver.requireCompany(1L)).thenReturn(company);
        when(leaveTypeRepository.findById(3L)).thenReturn(Optional.of(annual));
        when(leaveTypeRepository.findById(4L)).thenReturn(Optional.of(medical));
        when(publicHolidayRepository.findApplicable(eq(1L), any(), any())).thenReturn(List.of());
    }

    private static LeaveApplyRequestDto apply(Long typeId, LocalDate start, LocalDate end) {
        LeaveApplyRequestDto dto = new LeaveApplyRequestDto();
        dto.setLeaveTypeId(typeId);
        dto.setStartDate(start);
        dto.setEndDate(end);
        dto.setReason("Family trip");
        return dto;
    }

    private void balanceOf(LeaveType type, double entitled, double used) {
        when(leaveBalanceService.ensureBalance(employee, type, 2025)).thenReturn(LeaveBalance.builder()
                .employeeId(20L).leaveTypeId(type.getId()).year(2025)
                .entitledDays(entitled).carriedForward(0.0).usedDays(used).build());
    }

    @Test
    @DisplayName("평일 3일 신청은 total_days=3 으로 승인 흐름에 넘겨진다")
    void applyCountsWorkingDays() {
        balanceOf(annual, 12.0, 0.0);
        when(lifecycle.open(eq(leaveRequestKind), any(LeaveRequest.class), eq(employee), eq(company)))
                .thenAnswer(inv -> {
                    LeaveRequest request = inv.getArgument(1);
                    request.setId(100L);
                    request.setEmployeeId(20L);
                    request.setStatus(RequestStatus.PENDING);
                    request.setApprovalLevel(1);
                    return request;
                });

        LeaveRequestResponseDto result = leaveRequestService.apply(principal,
                apply(3L, LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12)));

        assertThat(result.getId()).isEqualTo(100L);
        assertThat(result.getTotalDays()).isEqualTo(3.0);
        assertThat(result.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(result.getApprovalLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("12월에 신청한 1월 휴가는 다음 해 횟수 제한으로 검사한다")
    void occurrenceCapUsesLeaveYear() {
        Clock december = Clock.fixed(ZonedDateTime.of(2025, 12, 20, 9, 0, 0, 0, ZONE).toInstant(), ZONE);
        LeaveRequestService service = new LeaveRequestService(leaveRequestRepository, leaveTypeRepository,
                publicHolidayRepository, leaveBalanceService, leaveRequestKind, lifecycle, permissionKernel, scopeResolver,
                employeeLookupService, new TransactionRunner(transactionManager), new EssPolicyProperties(), december);
        LeaveType compassionate = LeaveType.builder().id(6L).code("CL").name("Compassionate Leave")
                .paid(false).maxOccurrences(1).build();
        when(leaveTypeRepository.findById(6L)).thenReturn(Optional.of(compassionate));
        when(leaveRequestRepository.countOccurrences(eq(20L), eq(6L), anyCollection(),
                eq(LocalDate.of(2025, 1, 1)), eq(LocalDate.of(2025, 12, 31)))).thenReturn(1L);
        when(leaveRequestRepository.countOccurrences(eq(20L), eq(6L), anyCollection(),
                eq(LocalDate.of(2026, 1, 1)), eq(LocalDate.of(2026, 12, 31)))).thenReturn(0L);
        when(lifecycle.open(eq(leaveRequestKind), any(LeaveRequest.class), eq(employee), eq(company)))
                .thenAnswer(inv -> {
                    LeaveRequest request = inv.getArgument(1);
                    request.setId(101L);
                    request.setEmployeeId(20L);
                    request.setStatus(RequestStatus.PENDING);
                    return request;
                });

        LeaveRequestResponseDto result = service.apply(principal,
                apply(6L, LocalDate.of(2026, 1, 5), LocalDate.of(2026, 1, 5)));

        assertThat(result.getTotalDays()).isEqualTo(1.0);
        verify(lifecycle).open(eq(leaveRequestKind), any(LeaveRequest.class), eq(employee), eq(company));
    }

    @Test
    @DisplayName("잔여가 부족하면 신청할 수 없다")
    void insufficientBalance() {
        balanceOf(annual, 12.0, 11.0);

        assertThatThrownBy(() -> leaveRequestService.apply(principal,
                apply(3L, LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12))))
                .isInstanceOf(EssException.class)
                .hasMessageStartingWith("Insufficient leave balance");

        verify(lifecycle, never()).open(any(), any(), any(), any());
    }

    @Test
    @DisplayName("기존 승인/대기 휴가와 하루라도 겹치면 거부")
    void overlappingLeave() {
        when(leaveRequestRepository.existsOverlapping(eq(20L), eq(LocalDate.of(2025, 6, 12)),
                eq(LocalDate.of(2025, 6, 13)), anyCollection())).thenReturn(true);

        assertThatThrownBy(() -> leaveRequestService.apply(principal,
                apply(3L, LocalDate.of(2025, 6, 12), LocalDate.of(2025, 6, 13))))
                .isInstanceOf(EssException.class)
                .hasMessage("You already have a leave request for these dates")
                .extracting(e -> ((EssException) e).getKind())
                .isEqualTo(ErrorKind.CONFLICT);

        verify(lifecycle, never()).open(any(), any(), any(), any());
    }

    @Test
    @DisplayName("종료일이 시작일보다 빠르면 거부")
    void endBeforeStart() {
        assertThatThrownBy(() -> leaveRequestService.apply(principal,
                apply(3L, LocalDate.of(2025, 6, 12), LocalDate.of(2025, 6, 10))))
                .isInstanceOf(EssException.class)
                .hasMessage("End date cannot be before start date");
    }

    @Test
    @DisplayName("일반 휴가는 어제 날짜로 신청할 수 없다")
    void pastDateRejected() {
        assertThatThrownBy(() -> leaveRequestService.validateDates(annual, employee,
                TODAY.minusDays(1), TODAY.minusDays(1), TODAY))
                .isInstanceOf(EssException.class)
                .hasMessage("Cannot apply for leave on past dates");
    }

    @Test
    @DisplayName("병가는 7일 전까지 소급 가능, 8일 전은 거부")
    void medicalBackdateWindow() {
        leaveRequestService.validateDates(medical, employee, TODAY.minusDays(7), TODAY.minusDays(7), TODAY);

        assertThatThrownBy(() -> leaveRequestService.validateDates(medical, employee,
                TODAY.minusDays(8), TODAY.minusDays(8), TODAY))
                .isInstanceOf(EssException.class)
                .hasMessage("Medical leave can only be backdated up to 7 days");
    }

    @Test
    @DisplayName("첨부 필수 휴가는 첨부 없이 신청할 수 없다")
    void attachmentRequired() {
        assertThatThrownBy(() -> leaveRequestService.apply(principal,
                apply(4L, LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 10))))
                .isInstanceOf(EssException.class)
                .hasMessage("Attachment is required for this leave type");
    }

    @Test
    @DisplayName("다른 회사 전용 휴가 종류는 사용할 수 없다")
    void otherCompanyLeaveType() {
        LeaveType foreign = LeaveType.builder().id(9L).companyId(2L).code("XL").name("Other").build();
        when(leaveTypeRepository.findById(9L)).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> leaveRequestService.apply(principal,
                apply(9L, LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 10))))
                .isInstanceOf(EssException.class)
                .hasMessage("This leave type is not available for your company");
        verify(leaveRequestRepository, never()).existsOverlapping(anyLong(), any(), any(), anyCollection());
    }
}
