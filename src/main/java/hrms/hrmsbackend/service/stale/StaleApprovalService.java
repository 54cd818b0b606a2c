package hrms.hrmsbackend.service.stale;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.response.StaleApprovalResult;
import hrms.hrmsbackend.entity.mysql.approval.ApprovableRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.leave.LeaveRequestRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ExtraShiftRequestRepository;
import hrms.hrmsbackend.service.approval.RequestKindHandler;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.leave.LeaveRequestKind;
import hrms.hrmsbackend.service.schedule.ExtraShiftRequestKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 승인 기한이 지난 대기 요청 정리.
 * 휴가는 종료일이 지났고 신청 후 유예일수가 지난 건, 추가 근무는 근무일이 지난 건. 경비 청구는 대상 아님.
 * 병가는 최대 7일 소급 신청이 가능하므로 시작일은 기준으로 쓰지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleApprovalService {

    public static final String EXPIRED_REASON = "Approval window expired";

    private final LeaveRequestRepository leaveRequestRepository;
    private final ExtraShiftRequestRepository extraShiftRequestRepository;
    private final LeaveRequestKind leaveRequestKind;
    private final ExtraShiftRequestKind extraShiftRequestKind;
    private final RequestLifecycleService lifecycle;
    private final EssPolicyProperties policy;
    private final Clock clock;

    public StaleApprovalResult expireStaleRequests() {
        LocalDate today = LocalDate.now(clock);
        StaleApprovalResult result = new StaleApprovalResult();

        LocalDateTime appliedBefore = today.minusDays(Math.max(0, policy.getStaleGraceDays())).atStartOfDay();
        List<LeaveRequest> staleLeaves = leaveRequestRepository.findByStatusAndEndDateBefore(RequestStatus.PENDING, today)
                .stream()
                .filter(request -> request.getCreatedAt() != null && request.getCreatedAt().isBefore(appliedBefore))
                .collect(Collectors.toList());
        expireAll(leaveRequestKind, staleLeaves, result);
        expireAll(extraShiftRequestKind,
                extraShiftRequestRepository.findByStatusAndRequestDateBefore(RequestStatus.PENDING, today), result);
        return result;
    }

    // 건별 트랜잭션, 한 건의 실패가 나머지를 막지 않는다
    private <T extends ApprovableRequest> void expireAll(RequestKindHandler<T> handler, List<T> candidates,
                                                         StaleApprovalResult result) {
        for (T request : candidates) {
            result.setTotalCount(result.getTotalCount() + 1);
            try {
                if (lifecycle.expire(handler, request.getId(), EXPIRED_REASON)) {
                    result.setExpiredCount(result.getExpiredCount() + 1);
                }
            } catch (EssException | DataAccessException e) {
                log.error("{} 기한 만료 처리 실패 - id: {}", handler.kind(), request.getId(), e);
                result.setErrorCount(result.getErrorCount() + 1);
                result.getErrors().add(handler.kind().getReferenceType() + "#" + request.getId() + ": " + e.getMessage());
            }
        }
    }
}
