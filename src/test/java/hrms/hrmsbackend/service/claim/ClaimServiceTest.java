package hrms.hrmsbackend.service.claim;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.request.claim.ClaimRequestDto;
import hrms.hrmsbackend.dto.response.claim.ClaimResponseDto;
import hrms.hrmsbackend.entity.mysql.claim.Claim;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.GroupingType;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.enums.Role;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.claim.ClaimRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeOutletRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.service.approval.ApprovalStateMachine;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.notification.NotificationService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.service.permission.ScopeResolver;
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

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ClaimService 단위 테스트")
class ClaimServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kuala_Lumpur");

    @Mock
    private ClaimRepository claimRepository;
    @Mock
    private EmployeeLookupService employeeLookupService;
    @Mock
    private ScopeResolver scopeResolver;
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

    private ClaimService claimService;

    private final Employee employee = Employee.builder().id(30L).employeeCode("D030").name("Dina")
            .companyId(2L).departmentId(4L).employeeRole(EmployeeRole.STAFF).build();
    private final EssPrincipal principal = EssPrincipal.builder().id(30L).loginId("D030").companyId(2L)
            .role(Role.EMPLOYEE).employeeRole(EmployeeRole.STAFF).departmentId(4L).build();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(ZonedDateTime.of(2025, 6, 2, 9, 0, 0, 0, ZONE).toInstant(), ZONE);
        TransactionRunner transactionRunner = new TransactionRunner(transactionManager);
        RequestLifecycleService lifecycle = new RequestLifecycleService(new ApprovalStateMachine(), permissionKernel,
                notificationService, employeeRepository, employeeOutletRepository, transactionRunner,
                new EssPolicyProperties(), clock);
        claimService = new ClaimService(claimRepository, new ClaimRequestKind(claimRepository), lifecycle,
                employeeLookupService, scopeResolver, transactionRunner);

        when(employeeLookupService.requireSelf(principal)).thenReturn(employee);
        when(scopeResolver.requireCompany(2L)).thenReturn(Company.builder().id(2L).groupingType(GroupingType.DEPARTMENT).build());
        when(claimRepository.save(any(Claim.class))).thenAnswer(inv -> {
            Claim claim = inv.getArgument(0);
            claim.setId(70L);
            return claim;
        });
    }

    private static ClaimRequestDto dto(String category, String amount) {
        ClaimRequestDto dto = new ClaimRequestDto();
        dto.setClaimDate(LocalDate.of(2025, 5, 28));
        dto.setCategory(category);
        dto.setAmount(amount != null ? new BigDecimal(amount) : null);
        dto.setDescription("Client visit parking");
        return dto;
    }

    @Test
    @DisplayName("사무실 회사에서도 청구는 1단계 대기로 시작한다")
    void submitStartsAtLevelOne() {
        when(employeeRepository.findFirstByDepartmentIdAndEmployeeRoleAndStatus(eq(4L), eq(EmployeeRole.SUPERVISOR), any()))
                .thenReturn(Optional.of(Employee.builder().id(31L).name("Sup").companyId(2L).departmentId(4L)
                        .employeeRole(EmployeeRole.SUPERVISOR).build()));

        ClaimResponseDto result = claimService.submit(principal, dto("  Parking ", "12.50"));

        assertThat(result.getId()).isEqualTo(70L);
        assertThat(result.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(result.getApprovalLevel()).isEqualTo(1);
        assertThat(result.getCategory()).isEqualTo("Parking");
        assertThat(result.getEmployeeId()).isEqualTo(30L);
        verify(notificationService).send(eq(31L), eq(NotificationType.CLAIM), eq(NotificationTemplate.REQUEST_SUBMITTED),
                anyMap(), eq("claim"), eq(70L));
    }

    @Test
    @DisplayName("필수 항목이 없으면 거부")
    void missingFields() {
        assertThatThrownBy(() -> claimService.submit(principal, dto(" ", "10")))
                .isInstanceOf(EssException.class)
                .hasMessage("Claim date, category and amount are required");
        assertThatThrownBy(() -> claimService.submit(principal, dto("Meal", null)))
                .isInstanceOf(EssException.class)
                .hasMessage("Claim date, category and amount are required");
        verifyNoInteractions(claimRepository);
    }

    @Test
    @DisplayName("금액은 0보다 커야 한다")
    void nonPositiveAmount() {
        assertThatThrownBy(() -> claimService.submit(principal, dto("Meal", "0")))
                .isInstanceOf(EssException.class)
                .hasMessage("Amount must be greater than zero");
        verify(claimRepository, never()).save(any());
    }
}
