package hrms.hrmsbackend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    // 모든 "오늘" 판정은 회사 현지 시간 기준
    @Bean
    public Clock clock(EssPolicyProperties policy) {
        return Clock.system(ZoneId.of(policy.getZone()));
    }
}
