package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.request.schedule.ScheduleBulkCreateRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ScheduleCreateRequestDto;
import hrms.hrmsbackend.dto.response.schedule.BulkScheduleResultDto;
import hrms.hrmsbackend.dto.response.schedule.ScheduleResponseDto;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.entity.mysql.schedule.ShiftTemplate;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.enums.Role;
import hrms.hrmsbackend.enums.ScheduleStatus;
import hrms.hrmsbackend.exception.ErrorKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.repository.mysql.schedule.PublicHolidayRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ScheduleRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ShiftTemplateRepository;
import hrms.hrmsbackend.service.attendance.ClockInService;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import hrms.hrmsbackend.service.permission.Scope;
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
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ScheduleService 단위 테스트")
class ScheduleServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kuala_Lumpur");

    @Mock
    private ScheduleRepository scheduleRepository;
    @Mock
    private ShiftTemplateRepository shiftTemplateRepository;
    @Mock
    private PublicHolidayRepository publicHolidayRepository;
    @Mock
    private EmployeeRepository employeeRepository;
    @Mock
    private EmployeeLookupService employeeLookupService;
    @Mock
    private PermissionKernel permissionKernel;
    @Mock
    private ClockInService clockInService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ScheduleService scheduleService;

    private final EssPrincipal supervisor = EssPrincipal.builder().id(10L).loginId("S010").companyId(1L)
            .role(Role.EMPLOYEE).employeeRole(EmployeeRole.SUPERVISOR).outletId(7L).scheduleManager(true).build();
    private final Employee crew = Employee.builder().id(20L).employeeCode("S020").name("Siti")
            .companyId(1L).outletId(7L).employeeRole(EmployeeRole.STAFF).build();

    @BeforeEach
    void setUp() {
        // 2025-06-02 (월)
        Clock clock = Clock.fixed(ZonedDateTime.of(2025, 6, 2, 9, 0, 0, 0, ZONE).toInstant(), ZONE);
        EssPolicyProperties policy = new EssPolicyProperties();
        scheduleService = new ScheduleService(scheduleRepository, shiftTemplateRepository, publicHolidayRepository,
                employeeRepository, employeeLookupService, permissionKernel, new ScheduleEditPolicy(policy, clock),
                clockInService, new TransactionRunner(transactionManager), policy);

        when(permissionKernel.scopeOf(supervisor)).thenReturn(Scope.builder().build());
        when(employeeLookupService.require(20L)).thenReturn(crew);
        when(publicHolidayRepository.findApplicable(eq(1L), any(), any())).thenReturn(List.of());
        when(scheduleRepository.save(any(Schedule.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static ScheduleCreateRequestDto create(LocalDate date, Long templateId) {
        ScheduleCreateRequestDto dto = new ScheduleCreateRequestDto();
        dto.setEmployeeId(20L);
        dto.setScheduleDate(date);
        dto.setShiftTemplateId(templateId);
        if (templateId == null) {
            dto.setShiftStart(LocalTime.of(9, 0));
            dto.setShiftEnd(LocalTime.of(18, 0));
        }
        return dto;
    }

    @Test
    @DisplayName("직접 시간을 넣으면 기본 휴게 60분으로 생성하고 출퇴근 기록을 맞춘다")
    void createWithTimes() {
        LocalDate date = LocalDate.of(2025, 6, 5);

        ScheduleResponseDto result = scheduleService.create(supervisor, create(date, null));

        assertThat(result.getShiftStart()).isEqualTo(LocalTime.of(9, 0));
        assertThat(result.getBreakDuration()).isEqualTo(60);
        assertThat(result.getStatus()).isEqualTo(ScheduleStatus.SCHEDULED);
        verify(clockInService).syncSchedule(eq(20L), eq(date), any(Schedule.class));
    }

    @Test
    @DisplayName("OFF 템플릿은 시간 없이 OFF 상태로 저장된다")
    void offTemplate() {
        ShiftTemplate off = ShiftTemplate.builder().id(3L).companyId(1L).code("OFF").name("Off").off(true).build();
        when(shiftTemplateRepository.findById(3L)).thenReturn(Optional.of(off));

        ScheduleResponseDto result = scheduleService.create(supervisor, create(LocalDate.of(2025, 6, 6), 3L));

        assertThat(result.getStatus()).isEqualTo(ScheduleStatus.OFF);
        assertThat(result.getShiftStart()).isNull();
        assertThat(result.getBreakDuration()).isZero();
    }

    @Test
    @DisplayName("다른 회사 템플릿은 찾을 수 없다")
    void foreignTemplate() {
        ShiftTemplate foreign = ShiftTemplate.builder().id(4L).companyId(2L).code("AM").build();
        when(shiftTemplateRepository.findById(4L)).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> scheduleService.create(supervisor, create(LocalDate.of(2025, 6, 6), 4L)))
                .isInstanceOf(EssException.class)
                .hasMessage("Shift template not found");
    }

    @Test
    @DisplayName("감독자는 T+2 이내 날짜를 편집할 수 없다")
    void leadDaysRule() {
        assertThatThrownBy(() -> scheduleService.create(supervisor, create(LocalDate.of(2025, 6, 3), null)))
                .isInstanceOf(EssException.class)
                .hasMessage("Cannot create/edit schedules within 2 days (T+2 rule)");
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    @DisplayName("같은 날 스케줄이 이미 있으면 Conflict")
    void duplicate() {
        LocalDate date = LocalDate.of(2025, 6, 5);
        when(scheduleRepository.existsByEmployeeIdAndScheduleDate(20L, date)).thenReturn(true);

        assertThatThrownBy(() -> scheduleService.create(supervisor, create(date, null)))
                .isInstanceOf(EssException.class)
                .extracting(e -> ((EssException) e).getKind())
                .isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    @DisplayName("퇴사자와 마지막 근무일 이후에는 만들 수 없다")
    void resignedAndLastWorkingDay() {
        crew.setLastWorkingDay(LocalDate.of(2025, 6, 10));
        assertThatThrownBy(() -> scheduleService.create(supervisor, create(LocalDate.of(2025, 6, 11), null)))
                .isInstanceOf(EssException.class)
                .hasMessage("Cannot create schedules after employee's last working day (2025-06-10)");

        crew.setStatus(EmployeeStatus.RESIGNED);
        assertThatThrownBy(() -> scheduleService.create(supervisor, create(LocalDate.of(2025, 6, 5), null)))
                .isInstanceOf(EssException.class)
                .hasMessage("Cannot create schedules for resigned employees");
    }

    @Test
    @DisplayName("일괄 생성은 기존 날짜를 건너뛰고 행 오류를 모은다")
    void bulkCreate() {
        ScheduleBulkCreateRequestDto dto = new ScheduleBulkCreateRequestDto();
        dto.setEmployeeId(20L);
        dto.setStartDate(LocalDate.of(2025, 6, 2));
        dto.setEndDate(LocalDate.of(2025, 6, 13));
        dto.setDaysOfWeek(Set.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY));
        dto.setShiftStart(LocalTime.of(10, 0));
        dto.setShiftEnd(LocalTime.of(19, 0));
        when(scheduleRepository.existsByEmployeeIdAndScheduleDate(20L, LocalDate.of(2025, 6, 11))).thenReturn(true);

        BulkScheduleResultDto result = scheduleService.bulkCreate(supervisor, dto);

        // 6/2 는 T+2 위반, 6/11 은 기존 행
        assertThat(result.getCreated()).isEqualTo(4);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).getDate()).isEqualTo(LocalDate.of(2025, 6, 2));
        verify(scheduleRepository, times(4)).save(any(Schedule.class));
    }

    @Test
    @DisplayName("일괄 생성 범위에 맞는 요일이 없으면 거부")
    void bulkCreateNoDates() {
        ScheduleBulkCreateRequestDto dto = new ScheduleBulkCreateRequestDto();
        dto.setEmployeeId(20L);
        dto.setStartDate(LocalDate.of(2025, 6, 9));
        dto.setEndDate(LocalDate.of(2025, 6, 10));
        dto.setDaysOfWeek(Set.of(DayOfWeek.SUNDAY));

        assertThatThrownBy(() -> scheduleService.bulkCreate(supervisor, dto))
                .isInstanceOf(EssException.class)
                .hasMessage("No matching dates found in the specified range");
    }
}
