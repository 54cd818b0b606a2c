package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.entity.mysql.leave.EntitlementRule;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.RoundingDirection;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 근속 연수별 부여 일수, 연중 비례 적립, 이월, 수당 환산 계산
 */
public final class EntitlementCalculator {

    private static final double DAYS_PER_YEAR = 365.25;
    private static final BigDecimal WORKING_DAYS_PER_MONTH = BigDecimal.valueOf(22);

    private EntitlementCalculator() {
    }

    public static double serviceYears(LocalDate joinDate, LocalDate asOf) {
        if (joinDate == null || asOf.isBefore(joinDate)) {
            return 0.0;
        }
        return ChronoUnit.DAYS.between(joinDate, asOf) / DAYS_PER_YEAR;
    }

    public static long serviceDays(LocalDate joinDate, LocalDate asOf) {
        if (joinDate == null) {
            return 0;
        }
        return Math.max(0, ChronoUnit.DAYS.between(joinDate, asOf));
    }

    /**
     * 기준 연수 ≤ 근속 연수 중 가장 큰 규칙의 일수, 없으면 기본값
     */
    public static double entitledDays(LeaveType type, LocalDate joinDate, LocalDate asOf) {
        double years = serviceYears(joinDate, asOf);
        EntitlementRule best = null;
        if (type.getEntitlementRules() != null) {
            for (EntitlementRule rule : type.getEntitlementRules()) {
                if (rule.getMinServiceYears() == null || rule.getDays() == null) {
                    continue;
                }
                if (rule.getMinServiceYears() <= years
                        && (best == null || rule.getMinServiceYears() > best.getMinServiceYears())) {
                    best = rule;
                }
            }
        }
        if (best != null) {
            return best.getDays();
        }
        return type.getDefaultDaysPerYear() != null ? type.getDefaultDaysPerYear() : 0.0;
    }

    /**
     * 올해 입사자: 현재 월 - 입사 월 (0 미만은 0), 기존 직원: 현재 월 - 1
     */
    public static int completedMonths(LocalDate joinDate, LocalDate today) {
        if (joinDate != null && joinDate.getYear() == today.getYear()) {
            return Math.max(0, today.getMonthValue() - joinDate.getMonthValue());
        }
        if (joinDate != null && joinDate.getYear() > today.getYear()) {
            return 0;
        }
        return today.getMonthValue() - 1;
    }

    public static double round(double value, RoundingDirection direction) {
        if (direction == null) {
            direction = RoundingDirection.NEAREST;
        }
        return switch (direction) {
            case UP -> Math.ceil(value);
            case DOWN -> Math.floor(value);
            case NEAREST -> Math.round(value * 2) / 2.0; // 0.5일 단위
        };
    }

    public static Proration prorate(double entitled, double carriedForward, double used,
                                    LocalDate joinDate, LocalDate today, RoundingDirection rounding) {
        int months = completedMonths(joinDate, today);
        double ytdEarned = round(entitled * months / 12.0, rounding);
        double advance = entitled - ytdEarned;
        double earnedBalance = ytdEarned + carriedForward - used; // 음수 가능
        return new Proration(months, ytdEarned, advance, earnedBalance);
    }

    /**
     * 이월 일수 = min(max(0, 부여 + 이월 - 사용), 최대 이월)
     */
    public static double carryForward(double entitled, double carried, double used, double maxCarryForward) {
        double remaining = Math.max(0.0, entitled + carried - used);
        return Math.min(remaining, Math.max(0.0, maxCarryForward));
    }

    /**
     * 잔여 일수 × (기본급 / 22) × 배율
     */
    public static BigDecimal encashment(double remainingDays, BigDecimal basicSalary, BigDecimal rate) {
        if (basicSalary == null || remainingDays <= 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal dailyRate = basicSalary.divide(WORKING_DAYS_PER_MONTH, 6, RoundingMode.HALF_UP);
        return dailyRate.multiply(BigDecimal.valueOf(remainingDays))
                .multiply(rate != null ? rate : BigDecimal.ONE)
                .setScale(2, RoundingMode.HALF_UP);
    }

    @Getter
    @AllArgsConstructor
    public static class Proration {
        private final int completedMonths;
        private final double ytdEarned;
        private final double advanceLeave;
        private final double earnedBalance;
    }
}
