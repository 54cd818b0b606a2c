package hrms.hrmsbackend.service.attendance;

import hrms.hrmsbackend.entity.mysql.attendance.ClockInRecord;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 근무/휴게 시간 계산 (분 단위)
 */
public final class WorkTimeCalculator {

    private WorkTimeCalculator() {
    }

    public static WorkTime calculate(ClockInRecord record) {
        if (record == null || record.getClockIn1() == null) {
            return new WorkTime(0, 0);
        }
        long work = 0;
        long breakMinutes = 0;
        if (record.getClockOut1() != null) {
            work += span(record.getClockIn1(), record.getClockOut1());
        }
        if (record.getClockIn2() != null && record.getClockOut2() != null) {
            work += span(record.getClockIn2(), record.getClockOut2());
        }
        if (record.getClockOut1() == null && record.getClockIn2() == null && record.getClockOut2() != null) {
            // 휴게 없이 출근 → 퇴근
            work = span(record.getClockIn1(), record.getClockOut2());
        }
        if (record.getClockOut1() != null && record.getClockIn2() != null) {
            breakMinutes = span(record.getClockOut1(), record.getClockIn2());
        }
        return new WorkTime((int) work, (int) breakMinutes);
    }

    /**
     * 두 시각 사이 분. 타각은 날짜를 포함하므로 야간 근무도 그대로 계산된다.
     */
    static long span(LocalDateTime from, LocalDateTime to) {
        return Math.max(0, Duration.between(from, to).toMinutes());
    }

    @Getter
    public static class WorkTime {
        private final int workMinutes;
        private final int breakMinutes;

        public WorkTime(int workMinutes, int breakMinutes) {
            this.workMinutes = workMinutes;
            this.breakMinutes = breakMinutes;
        }
    }
}
