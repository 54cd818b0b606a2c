package hrms.hrmsbackend.service.attendance;

import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.enums.OtDayType;
import hrms.hrmsbackend.enums.OtRoundingUnit;
import hrms.hrmsbackend.enums.RoundingDirection;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;

/**
 * OT 분 계산과 일자 구분/배율
 */
public final class OvertimeCalculator {

    private OvertimeCalculator() {
    }

    /**
     * 기준 근무 분. 근무 스케줄이 있으면 (종료 - 시작) 구간 전체, 없으면 회사 OT 기준 시간.
     */
    public static int baselineMinutes(Schedule schedule, Company company, int fallbackMinutes) {
        if (schedule != null && schedule.isWorkingShift()
                && schedule.getShiftStart() != null && schedule.getShiftEnd() != null) {
            long span = Duration.between(schedule.getShiftStart(), schedule.getShiftEnd()).toMinutes();
            if (span <= 0) {
                span += 24 * 60; // 야간 근무
            }
            return (int) span;
        }
        if (company != null && company.getOtThresholdHours() != null) {
            return (int) Math.round(company.getOtThresholdHours() * 60);
        }
        return fallbackMinutes;
    }

    public static int overtimeMinutes(int workMinutes, int baselineMinutes, Company company) {
        int raw = Math.max(0, workMinutes - baselineMinutes);
        if (company == null) {
            return raw;
        }
        return round(raw, company.getOtRoundingUnit(), company.getOtRoundingDirection());
    }

    public static int round(int minutes, OtRoundingUnit unit, RoundingDirection direction) {
        int step = unit != null ? unit.getMinutes() : 1;
        if (step <= 1 || minutes == 0) {
            return minutes;
        }
        double units = (double) minutes / step;
        long rounded = switch (direction != null ? direction : RoundingDirection.NEAREST) {
            case UP -> (long) Math.ceil(units);
            case DOWN -> (long) Math.floor(units);
            case NEAREST -> Math.round(units);
        };
        return (int) (rounded * step);
    }

    public static OtDayType dayType(LocalDate date, Set<LocalDate> holidays) {
        if (holidays != null && holidays.contains(date)) {
            return OtDayType.PUBLIC_HOLIDAY;
        }
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return OtDayType.WEEKEND;
        }
        return OtDayType.NORMAL;
    }

    public static double multiplier(Company company, OtDayType dayType) {
        return switch (dayType) {
            case PUBLIC_HOLIDAY -> orDefault(company.getOtPublicHolidayMultiplier(), 2.0);
            case WEEKEND -> orDefault(company.getOtWeekendMultiplier(), 1.5);
            case NORMAL -> orDefault(company.getOtNormalMultiplier(), 1.5);
        };
    }

    public static String formatHours(Integer minutes) {
        if (minutes == null) {
            return "0.00";
        }
        return String.format(Locale.ROOT, "%.2f", minutes / 60.0);
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
