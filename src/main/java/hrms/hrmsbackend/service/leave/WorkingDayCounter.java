package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.enums.WorkingWeek;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Set;

/**
 * 휴가 일수 계산.
 * 매장 회사는 월~일 근무(공휴일만 제외), 사무실 회사는 주말과 공휴일 제외.
 * 연속 휴가(출산/배우자 출산)는 달력 일수 그대로.
 */
public final class WorkingDayCounter {

    public static final double HALF_DAY = 0.5;

    private WorkingDayCounter() {
    }

    public static double count(LocalDate start, LocalDate end, WorkingWeek workingWeek, Set<LocalDate> holidays,
                               boolean consecutive, boolean halfDay) {
        if (start == null || end == null || end.isBefore(start)) {
            return 0.0;
        }
        long counted;
        if (consecutive) {
            counted = ChronoUnit.DAYS.between(start, end) + 1;
        } else {
            counted = 0;
            for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
                if (workingWeek.isWorkingDay(d) && (holidays == null || !holidays.contains(d))) {
                    counted++;
                }
            }
        }
        if (halfDay && counted == 1) {
            return HALF_DAY;
        }
        return counted;
    }
}
