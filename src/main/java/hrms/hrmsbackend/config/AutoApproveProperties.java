package hrms.hrmsbackend.config;

import hrms.hrmsbackend.enums.GroupingType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 생성 즉시 승인되는 (회사 유형, 휴가 코드) 조합
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "ess")
public class AutoApproveProperties {

    private List<Rule> autoApprove = new ArrayList<>(List.of(new Rule(GroupingType.DEPARTMENT, "AL")));

    public boolean matches(GroupingType grouping, String leaveCode) {
        if (grouping == null || leaveCode == null) {
            return false;
        }
        return autoApprove.stream()
                .anyMatch(rule -> rule.getGrouping() == grouping && leaveCode.equalsIgnoreCase(rule.getLeaveCode()));
    }

    @Setter
    @Getter
    @NoArgsConstructor
    public static class Rule {
        private GroupingType grouping;
        private String leaveCode;

        public Rule(GroupingType grouping, String leaveCode) {
            this.grouping = grouping;
            this.leaveCode = leaveCode;
        }
    }
}
