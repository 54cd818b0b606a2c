package hrms.hrmsbackend.service.stale;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.response.StaleApprovalResult;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.schedule.ExtraShiftRequest;
import hrms.hrmsbackend.enums.RequestKind;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.leave.LeaveRequestRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ExtraShiftRequestRepository;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.leave.LeaveRequestKind;
import hrms.hrmsbackend.service.schedule.ExtraShiftRequestKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("StaleApprovalService 단위 테스트")
class StaleApprovalServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Kuala_Lumpur");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 10);

    @Mock
    private LeaveRequestRepository leaveRequestRepository;
    @Mock
    private ExtraShiftRequestRepository extraShiftRequestRepository;
    @Mock
    private LeaveRequestKind leaveRequestKind;
    @Mock
    private ExtraShiftRequestKind extraShiftRequestKind;
    @Mock
    private RequestLifecycleService lifecycle;

    private EssPolicyProperties policy;
    private StaleApprovalService staleApprovalService;

    @BeforeEach
    void setUp() {
        policy = new EssPolicyProperties();
        Clock clock = Clock.fixed(ZonedDateTime.of(2025, 6, 10, 0, 30, 0, 0, ZONE).toInstant(), ZONE);
        staleApprovalService = new StaleApprovalService(leaveRequestRepository, extraShiftRequestRepository,
                leaveRequestKind, extraShiftRequestKind, lifecycle, policy, clock);
        when(leaveRequestKind.kind()).thenReturn(RequestKind.LEAVE);
        when(extraShiftRequestKind.kind()).thenReturn(RequestKind.EXTRA_SHIFT);
    }

    private static LeaveRequest leave(Long id) {
        return leave(id, LocalDateTime.of(2025, 5, 20, 9, 0));
    }

    private static LeaveRequest leave(Long id, LocalDateTime appliedAt) {
        LeaveRequest request = new LeaveRequest();
        request.setId(id);
        request.setCreatedAt(appliedAt);
        return request;
    }

    private static ExtraShiftRequest extraShift(Long id) {
        ExtraShiftRequest request = new ExtraShiftRequest();
        request.setId(id);
        return request;
    }

    @Test
    @DisplayName("종료일이 지난 대기 휴가와 근무일이 지난 추가 근무를 만료시킨다")
    void expiresBothKinds() {
        when(leaveRequestRepository.findByStatusAndEndDateBefore(RequestStatus.PENDING, TODAY))
                .thenReturn(List.of(leave(1L), leave(2L)));
        when(extraShiftRequestRepository.findByStatusAndRequestDateBefore(RequestStatus.PENDING, TODAY))
                .thenReturn(List.of(extraShift(5L)));
        when(lifecycle.expire(leaveRequestKind, 1L, StaleApprovalService.EXPIRED_REASON)).thenReturn(true);
        when(lifecycle.expire(leaveRequestKind, 2L, StaleApprovalService.EXPIRED_REASON)).thenReturn(false);
        when(lifecycle.expire(extraShiftRequestKind, 5L, StaleApprovalService.EXPIRED_REASON)).thenReturn(true);

        StaleApprovalResult result = staleApprovalService.expireStaleRequests();

        assertThat(result.getTotalCount()).isEqualTo(3);
        assertThat(result.getExpiredCount()).isEqualTo(2);
        assertThat(result.getErrorCount()).isZero();
    }

    @Test
    @DisplayName("신청 후 유예일수가 지나지 않은 휴가는 남겨둔다")
    void graceDaysCountFromApplication() {
        policy.setStaleGraceDays(3);
        when(leaveRequestRepository.findByStatusAndEndDateBefore(RequestStatus.PENDING, TODAY))
                .thenReturn(List.of(leave(1L, LocalDateTime.of(2025, 6, 6, 23, 0)),
                        leave(2L, LocalDateTime.of(2025, 6, 7, 8, 0))));
        when(lifecycle.expire(leaveRequestKind, 1L, StaleApprovalService.EXPIRED_REASON)).thenReturn(true);

        StaleApprovalResult result = staleApprovalService.expireStaleRequests();

        assertThat(result.getExpiredCount()).isEqualTo(1);
        verify(lifecycle, never()).expire(leaveRequestKind, 2L, StaleApprovalService.EXPIRED_REASON);
        verify(extraShiftRequestRepository).findByStatusAndRequestDateBefore(RequestStatus.PENDING, TODAY);
    }

    @Test
    @DisplayName("소급 신청한 병가는 다음 날 배치에서 만료되지 않는다")
    void backdatedMedicalLeaveSurvivesNextRun() {
        Clock nextNight = Clock.fixed(ZonedDateTime.of(2025, 6, 11, 0, 30, 0, 0, ZONE).toInstant(), ZONE);
        StaleApprovalService service = new StaleApprovalService(leaveRequestRepository, extraShiftRequestRepository,
                leaveRequestKind, extraShiftRequestKind, lifecycle, policy, nextNight);
        LeaveRequest medical = leave(7L, LocalDateTime.of(2025, 6, 10, 14, 0));
        medical.setStartDate(LocalDate.of(2025, 6, 7));
        medical.setEndDate(LocalDate.of(2025, 6, 8));
        when(leaveRequestRepository.findByStatusAndEndDateBefore(RequestStatus.PENDING, LocalDate.of(2025, 6, 11)))
                .thenReturn(List.of(medical));

        StaleApprovalResult result = service.expireStaleRequests();

        assertThat(result.getExpiredCount()).isZero();
        verify(lifecycle, never()).expire(eq(leaveRequestKind), anyLong(), anyString());
    }

    @Test
    @DisplayName("한 건이 실패해도 나머지는 계속 처리한다")
    void failureDoesNotStopBatch() {
        when(leaveRequestRepository.findByStatusAndEndDateBefore(RequestStatus.PENDING, TODAY))
                .thenReturn(List.of(leave(1L), leave(2L), leave(3L)));
        when(lifecycle.expire(leaveRequestKind, 1L, StaleApprovalService.EXPIRED_REASON))
                .thenThrow(EssException.notFound("Leave request"));
        when(lifecycle.expire(leaveRequestKind, 2L, StaleApprovalService.EXPIRED_REASON))
                .thenThrow(new CannotAcquireLockException("lock wait timeout"));
        when(lifecycle.expire(leaveRequestKind, 3L, StaleApprovalService.EXPIRED_REASON)).thenReturn(true);

        StaleApprovalResult result = staleApprovalService.expireStaleRequests();

        assertThat(result.getExpiredCount()).isEqualTo(1);
        assertThat(result.getErrorCount()).isEqualTo(2);
        assertThat(result.getErrors()).containsExactly(
                "leave#1: Leave request not found",
                "leave#2: lock wait timeout");
    }
}
