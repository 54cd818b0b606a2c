package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.config.AutoApproveProperties;
import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveBalance;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.enums.GroupingType;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.enums.Role;
import hrms.hrmsbackend.exception.ErrorKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeOutletRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveBalanceRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveRequestRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveTypeRepository;
import hrms.hrmsbackend.service.approval.ApprovalStateMachine;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.notification.NotificationService;
import hrms.hrmsbackend.service.permission.Capability;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.template.NotificationTemplate;
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
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 휴가 신청부터 단계별 승인, 자동 승인, 되돌림, 취소까지의 흐름.
 * 상태 전이와 잔여 차감은 실제 구현을 쓰고 저장소만 mock 으로 둔다.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("휴가 승인 흐름 테스트")
class LeaveApprovalFlowTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kuala_Lumpur");
    private static final Long REQUEST_ID = 100L;

    @Mock
    private LeaveRequestRepository leaveRequestRepository;
    @Mock
    private LeaveTypeRepository leaveTypeRepository;
    @Mock
    private LeaveBalanceRepository leaveBalanceRepository;
    @Mock
    private EmployeeRepository employeeRepository;
    @Mock
    private EmployeeOutletRepository employeeOutletRepository;
    @Mock
    private PermissionKernel permissionKernel;
    @Mock
    private NotificationService notificationService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private RequestLifecycleService lifecycle;
    private LeaveRequestKind leaveKind;

    private final LeaveType annual = LeaveType.builder().id(3L).code("AL").name("Annual Leave").paid(true).build();
    private final Employee staff = Employee.builder().id(20L).employeeCode("S020").name("Siti")
            .companyId(1L).outletId(7L).employeeRole(EmployeeRole.STAFF).status(EmployeeStatus.ACTIVE).build();
    private final Employee supervisorEmployee = Employee.builder().id(10L).employeeCode("S010").name("Sam")
            .companyId(1L).outletId(7L).employeeRole(EmployeeRole.SUPERVISOR).status(EmployeeStatus.ACTIVE).build();

    private final EssPrincipal supervisor = EssPrincipal.builder().id(10L).loginId("S010").name("Sam")
            .companyId(1L).role(Role.EMPLOYEE).employeeRole(EmployeeRole.SUPERVISOR).outletId(7L).build();
    private final EssPrincipal manager = EssPrincipal.builder().id(11L).loginId("S011").name("Mei")
            .companyId(1L).role(Role.EMPLOYEE).employeeRole(EmployeeRole.MANAGER).build();
    private final EssPrincipal admin = EssPrincipal.builder().id(1L).loginId("hr")
            .companyId(1L).role(Role.ADMIN).build();
    private final EssPrincipal owner = EssPrincipal.builder().id(20L).loginId("S020").name("Siti")
            .companyId(1L).role(Role.EMPLOYEE).employeeRole(EmployeeRole.STAFF).outletId(7L).build();

    private LeaveRequest stored;
    private LeaveBalance balance;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(ZonedDateTime.of(2025, 6, 2, 9, 0, 0, 0, ZONE).toInstant(), ZONE);
        TransactionRunner transactionRunner = new TransactionRunner(transactionManager);
        LeaveBalanceService balanceService = new LeaveBalanceService(leaveBalanceRepository, leaveTypeRepository,
                employeeRepository, clock);
        leaveKind = new LeaveRequestKind(leaveRequestRepository, leaveTypeRepository, balanceService, new AutoApproveProperties());
        lifecycle = new RequestLifecycleService(new ApprovalStateMachine(), permissionKernel, notificationService,
                employeeRepository, employeeOutletRepository, transactionRunner, new EssPolicyProperties(), clock);

        balance = LeaveBalance.builder().id(5L).employeeId(20L).leaveTypeId(3L).year(2025)
                .entitledDays(12.0).carriedForward(0.0).usedDays(0.0).build();

        when(leaveTypeRepository.findById(3L)).thenReturn(Optional.of(annual));
        when(employeeRepository.findById(20L)).thenReturn(Optional.of(staff));
        when(leaveBalanceRepository.findForUpdate(20L, 3L, 2025)).thenReturn(Optional.of(balance));
        when(leaveBalanceRepository.save(any(LeaveBalance.class))).thenAnswer(inv -> inv.getArgument(0));
        when(leaveRequestRepository.save(any(LeaveRequest.class))).thenAnswer(inv -> {
            LeaveRequest request = inv.getArgument(0);
            if (request.getId() == null) {
                request.setId(REQUEST_ID);
            }
            stored = request;
            return request;
        });
        when(leaveRequestRepository.findWithLockById(REQUEST_ID)).thenAnswer(inv -> Optional.ofNullable(stored));
    }

    private static LeaveRequest request(LocalDate start, LocalDate end, double days) {
        LeaveRequest request = new LeaveRequest();
        request.setLeaveTypeId(3L);
        request.setStartDate(start);
        request.setEndDate(end);
        request.setTotalDays(days);
        request.setBalanceYear(start.getYear());
        return request;
    }

    private LeaveRequest openOutletRequest() {
        Company outletCompany = Company.builder().id(1L).groupingType(GroupingType.OUTLET).build();
        return lifecycle.open(leaveKind,
                request(LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12), 3.0), staff, outletCompany);
    }

    @Test
    @DisplayName("매장 회사: supervisor → manager → admin 순서로 승인되고 최종 승인 시에만 차감")
    void outletThreeLevelApproval() {
        when(employeeRepository.findFirstByOutletIdAndEmployeeRoleAndStatus(7L, EmployeeRole.SUPERVISOR, EmployeeStatus.ACTIVE))
                .thenReturn(Optional.of(supervisorEmployee));

        LeaveRequest created = openOutletRequest();
        assertThat(created.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(created.getApprovalLevel()).isEqualTo(ApprovalStateMachine.LEVEL_SUPERVISOR);
        verify(notificationService).send(eq(10L), eq(NotificationType.LEAVE), eq(NotificationTemplate.REQUEST_SUBMITTED),
                anyMap(), eq("leave"), eq(REQUEST_ID));

        LeaveRequest afterSupervisor = lifecycle.approve(leaveKind, REQUEST_ID, supervisor);
        assertThat(afterSupervisor.getApprovalLevel()).isEqualTo(ApprovalStateMachine.LEVEL_MANAGER);
        assertThat(afterSupervisor.getSupervisorId()).isEqualTo(10L);
        assertThat(afterSupervisor.getSupervisorApprovedAt()).isNotNull();

        LeaveRequest afterManager = lifecycle.approve(leaveKind, REQUEST_ID, manager);
        assertThat(afterManager.getApprovalLevel()).isEqualTo(ApprovalStateMachine.LEVEL_ADMIN);
        assertThat(afterManager.getManagerId()).isEqualTo(11L);
        assertThat(balance.getUsedDays()).isZero();

        LeaveRequest approved = lifecycle.approve(leaveKind, REQUEST_ID, admin);
        assertThat(approved.getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(approved.getApprovedBy()).isEqualTo(1L);
        assertThat(balance.getUsedDays()).isEqualTo(3.0);
        verify(notificationService).send(eq(20L), eq(NotificationType.LEAVE), eq(NotificationTemplate.REQUEST_APPROVED),
                anyMap(), eq("leave"), eq(REQUEST_ID));
    }

    @Test
    @DisplayName("사무실 회사 연차는 생성 즉시 자동 승인되고 되돌리면 잔여가 정확히 복원된다")
    void officeAutoApproveAndRevert() {
        Company office = Company.builder().id(1L).groupingType(GroupingType.DEPARTMENT).build();
        balance.setEntitledDays(14.0);

        LeaveRequest created = lifecycle.open(leaveKind,
                request(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 2), 2.0), staff, office);

        assertThat(created.getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(created.isAutoApproved()).isTrue();
        assertThat(created.getAutoApprovedAt()).isNotNull();
        assertThat(balance.getUsedDays()).isEqualTo(2.0);
        verify(notificationService).send(eq(20L), eq(NotificationType.LEAVE), eq(NotificationTemplate.REQUEST_AUTO_APPROVED),
                anyMap(), eq("leave"), eq(REQUEST_ID));

        LeaveRequest reverted = lifecycle.revert(leaveKind, REQUEST_ID, owner);

        assertThat(reverted.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(reverted.getApprovalLevel()).isEqualTo(ApprovalStateMachine.LEVEL_ADMIN);
        assertThat(reverted.isAutoApproved()).isFalse();
        assertThat(balance.getUsedDays()).isZero();
    }

    @Test
    @DisplayName("계층 거부 시 상태가 바뀌지 않는다")
    void hierarchyDenialLeavesStateUntouched() {
        openOutletRequest();
        doThrow(EssException.forbidden("Hierarchy restriction: your level (60) must be higher than the requester's level (80)"))
                .when(permissionKernel).requireApproval(supervisor, staff, Capability.APPROVE_LEAVE);

        assertThatThrownBy(() -> lifecycle.approve(leaveKind, REQUEST_ID, supervisor))
                .isInstanceOf(EssException.class)
                .hasMessageContaining("Hierarchy restriction");

        assertThat(stored.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(stored.getApprovalLevel()).isEqualTo(ApprovalStateMachine.LEVEL_SUPERVISOR);
        assertThat(stored.getSupervisorId()).isNull();
    }

    @Test
    @DisplayName("이미 처리된 요청은 다시 승인할 수 없다")
    void approveTwiceConflicts() {
        openOutletRequest();
        stored.setStatus(RequestStatus.REJECTED);

        assertThatThrownBy(() -> lifecycle.approve(leaveKind, REQUEST_ID, admin))
                .isInstanceOf(EssException.class)
                .hasMessage(ApprovalStateMachine.NOT_PENDING)
                .extracting(e -> ((EssException) e).getKind())
                .isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    @DisplayName("본인 취소는 pending 에서만 가능하고 잔여를 건드리지 않는다")
    void ownerCancelPending() {
        openOutletRequest();

        LeaveRequest cancelled = lifecycle.cancel(leaveKind, REQUEST_ID, owner);

        assertThat(cancelled.getStatus()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(cancelled.getCancelledAt()).isNotNull();
        verify(leaveBalanceRepository, never()).findForUpdate(anyLong(), anyLong(), any());
    }

    @Test
    @DisplayName("다른 직원의 요청은 취소할 수 없다")
    void cancelOthersForbidden() {
        openOutletRequest();

        assertThatThrownBy(() -> lifecycle.cancel(leaveKind, REQUEST_ID, supervisor))
                .isInstanceOf(EssException.class)
                .hasMessage("You can only cancel your own requests");
    }

    @Test
    @DisplayName("관리자가 승인 건을 취소하면 차감분이 복원된다")
    void adminCancelApprovedCredits() {
        openOutletRequest();
        stored.setApprovalLevel(ApprovalStateMachine.LEVEL_ADMIN);
        lifecycle.approve(leaveKind, REQUEST_ID, admin);
        assertThat(balance.getUsedDays()).isEqualTo(3.0);

        LeaveRequest cancelled = lifecycle.cancel(leaveKind, REQUEST_ID, admin);

        assertThat(cancelled.getStatus()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(balance.getUsedDays()).isZero();
    }

    @Test
    @DisplayName("반려 사유가 알림 변수로 전달된다")
    void rejectNotifiesReason() {
        openOutletRequest();

        LeaveRequest rejected = lifecycle.reject(leaveKind, REQUEST_ID, supervisor, "Short staffed");

        assertThat(rejected.getStatus()).isEqualTo(RequestStatus.REJECTED);
        assertThat(rejected.getRejectedByRole()).isEqualTo("supervisor");
        assertThat(rejected.getRejectionReason()).isEqualTo("Short staffed");
        verify(notificationService).send(eq(20L), eq(NotificationType.LEAVE), eq(NotificationTemplate.REQUEST_REJECTED),
                argThat(vars -> "Short staffed".equals(vars.get("reason"))),
                eq("leave"), eq(REQUEST_ID));
    }
}
