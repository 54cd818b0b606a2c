package hrms.hrmsbackend.util;

import hrms.hrmsbackend.dto.response.StaleApprovalResult;
import hrms.hrmsbackend.service.stale.StaleApprovalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Slf4j
@RequiredArgsConstructor
public class StaleApprovalScheduler {

    private final StaleApprovalService staleApprovalService;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    /**
     * 매일 00:30 승인 기한 지난 대기 요청 반려
     */
    @Scheduled(cron = "${ess.policy.stale-cron:0 30 0 * * ?}", zone = "${ess.policy.zone:Asia/Kuala_Lumpur}")
    public void scheduledExpire() {
        if (isRunning.compareAndSet(false, true)) {
            try {
                log.info("=== 승인 기한 만료 처리 시작 ===");

                StaleApprovalResult result = staleApprovalService.expireStaleRequests();

                log.info("=== 승인 기한 만료 처리 완료 - 대상: {}, 반려: {}, 실패: {} ===",
                        result.getTotalCount(), result.getExpiredCount(), result.getErrorCount());

                if (result.getErrorCount() > 0) {
                    log.warn("승인 기한 만료 처리 중 {}건의 오류가 발생했습니다.", result.getErrorCount());
                }
            } catch (RuntimeException e) {
                log.error("승인 기한 만료 처리 중 오류 발생", e);
            } finally {
                isRunning.set(false);
            }
        } else {
            log.warn("이미 승인 기한 만료 처리가 실행 중입니다.");
        }
    }
}
