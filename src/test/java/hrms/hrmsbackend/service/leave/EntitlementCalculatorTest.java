package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.entity.mysql.leave.EntitlementRule;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.RoundingDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EntitlementCalculator 단위 테스트")
class EntitlementCalculatorTest {

    private static LeaveType annualLeave() {
        return LeaveType.builder()
                .code("AL")
                .name("Annual Leave")
                .defaultDaysPerYear(8.0)
                .entitlementRules(new ArrayList<>(List.of(
                        new EntitlementRule(0.0, 8.0),
                        new EntitlementRule(2.0, 12.0),
                        new EntitlementRule(5.0, 16.0))))
                .build();
    }

    @Test
    @DisplayName("근속 연수 이하 규칙 중 가장 큰 구간을 쓴다")
    void picksHighestApplicableRule() {
        LeaveType type = annualLeave();

        assertThat(EntitlementCalculator.entitledDays(type, LocalDate.of(2024, 9, 1), LocalDate.of(2025, 6, 1))).isEqualTo(8.0);
        assertThat(EntitlementCalculator.entitledDays(type, LocalDate.of(2021, 6, 1), LocalDate.of(2025, 6, 1))).isEqualTo(12.0);
        assertThat(EntitlementCalculator.entitledDays(type, LocalDate.of(2015, 1, 1), LocalDate.of(2025, 6, 1))).isEqualTo(16.0);
    }

    @Test
    @DisplayName("규칙이 없으면 기본 일수")
    void fallsBackToDefault() {
        LeaveType type = LeaveType.builder().code("SL").defaultDaysPerYear(14.0).build();

        assertThat(EntitlementCalculator.entitledDays(type, LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1))).isEqualTo(14.0);
    }

    @Test
    @DisplayName("기존 직원은 (현재 월 - 1) 개월분 적립")
    void prorationForExistingEmployee() {
        EntitlementCalculator.Proration p = EntitlementCalculator.prorate(12.0, 2.0, 1.0,
                LocalDate.of(2020, 1, 1), LocalDate.of(2025, 6, 15), RoundingDirection.NEAREST);

        assertThat(p.getCompletedMonths()).isEqualTo(5);
        assertThat(p.getYtdEarned()).isEqualTo(5.0);
        assertThat(p.getAdvanceLeave()).isEqualTo(7.0);
        assertThat(p.getEarnedBalance()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("올해 입사자는 입사 월부터 계산하고 0.5일 단위 반올림")
    void prorationForNewJoiner() {
        EntitlementCalculator.Proration p = EntitlementCalculator.prorate(14.0, 0.0, 0.0,
                LocalDate.of(2025, 3, 10), LocalDate.of(2025, 6, 15), RoundingDirection.NEAREST);

        assertThat(p.getCompletedMonths()).isEqualTo(3);
        assertThat(p.getYtdEarned()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("적립분을 초과 사용하면 earned balance 는 음수")
    void earnedBalanceMayGoNegative() {
        EntitlementCalculator.Proration p = EntitlementCalculator.prorate(12.0, 0.0, 4.0,
                LocalDate.of(2020, 1, 1), LocalDate.of(2025, 3, 1), RoundingDirection.DOWN);

        assertThat(p.getYtdEarned()).isEqualTo(2.0);
        assertThat(p.getEarnedBalance()).isEqualTo(-2.0);
    }

    @Test
    @DisplayName("이월은 잔여와 최대 이월 중 작은 값")
    void carryForwardIsCapped() {
        assertThat(EntitlementCalculator.carryForward(14.0, 2.0, 10.0, 5.0)).isEqualTo(5.0);
        assertThat(EntitlementCalculator.carryForward(14.0, 0.0, 12.0, 5.0)).isEqualTo(2.0);
        assertThat(EntitlementCalculator.carryForward(8.0, 0.0, 10.0, 5.0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("수당 환산 = 잔여 × (기본급 / 22) × 배율")
    void encashment() {
        assertThat(EntitlementCalculator.encashment(10.0, new BigDecimal("2200"), BigDecimal.ONE))
                .isEqualByComparingTo("1000.00");
        assertThat(EntitlementCalculator.encashment(0.0, new BigDecimal("2200"), BigDecimal.ONE))
                .isEqualByComparingTo("0");
        assertThat(EntitlementCalculator.encashment(5.0, null, BigDecimal.ONE))
                .isEqualByComparingTo("0");
    }
}
