package hrms.hrmsbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * ess.policy.* 업무 정책 값
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "ess.policy")
public class EssPolicyProperties {

    // 진단서 첨부 휴가의 소급 신청 허용 일수
    private int medicalBackdateDays = 7;

    // 자동 승인 휴가 되돌리기 허용 일수 (0 = 제한 없음)
    private int revertWindowDays = 0;

    // 신청 후 이 일수가 지나야 만료 대상 (소급 병가 검토 기간 확보)
    private int staleGraceDays = 7;

    private String staleCron = "0 30 0 * * ?";

    private int otFlagMinutes = 60;

    private int standardWorkMinutes = 510;

    private int defaultBreakMinutes = 60;

    // 스케줄 편집 가능 최소 일수 (T+2)
    private int scheduleLeadDays = 2;

    private String zone = "Asia/Kuala_Lumpur";
}
