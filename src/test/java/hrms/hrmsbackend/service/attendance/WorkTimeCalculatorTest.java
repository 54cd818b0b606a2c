package hrms.hrmsbackend.service.attendance;

import hrms.hrmsbackend.entity.mysql.attendance.ClockInRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkTimeCalculator 테스트")
class WorkTimeCalculatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 6, 3);

    private static ClockInRecord record(LocalDateTime in1, LocalDateTime out1, LocalDateTime in2, LocalDateTime out2) {
        ClockInRecord record = new ClockInRecord();
        record.setClockIn1(in1);
        record.setClockOut1(out1);
        record.setClockIn2(in2);
        record.setClockOut2(out2);
        return record;
    }

    @Test
    @DisplayName("네 번 찍으면 근무 두 구간을 더하고 사이를 휴게로 본다")
    void fourPunches() {
        WorkTimeCalculator.WorkTime time = WorkTimeCalculator.calculate(record(DAY.atTime(9, 0), DAY.atTime(12, 30),
                DAY.atTime(13, 15), DAY.atTime(18, 0)));

        assertThat(time.getWorkMinutes()).isEqualTo(210 + 285);
        assertThat(time.getBreakMinutes()).isEqualTo(45);
    }

    @Test
    @DisplayName("휴게 없이 출근 후 바로 퇴근")
    void directClockOut() {
        WorkTimeCalculator.WorkTime time = WorkTimeCalculator.calculate(record(DAY.atTime(9, 0), null, null,
                DAY.atTime(17, 0)));

        assertThat(time.getWorkMinutes()).isEqualTo(480);
        assertThat(time.getBreakMinutes()).isZero();
    }

    @Test
    @DisplayName("자정을 넘긴 야간 근무")
    void overnight() {
        WorkTimeCalculator.WorkTime time = WorkTimeCalculator.calculate(record(DAY.atTime(22, 0), null, null,
                DAY.plusDays(1).atTime(6, 0)));

        assertThat(time.getWorkMinutes()).isEqualTo(480);
    }

    @Test
    @DisplayName("출근 기록이 없으면 0")
    void noClockIn() {
        WorkTimeCalculator.WorkTime time = WorkTimeCalculator.calculate(new ClockInRecord());

        assertThat(time.getWorkMinutes()).isZero();
        assertThat(time.getBreakMinutes()).isZero();
    }

    @Test
    @DisplayName("휴게 중이면 첫 구간만 근무로 센다")
    void onBreak() {
        WorkTimeCalculator.WorkTime time = WorkTimeCalculator.calculate(record(DAY.atTime(9, 0), DAY.atTime(13, 0),
                null, null));

        assertThat(time.getWorkMinutes()).isEqualTo(240);
        assertThat(time.getBreakMinutes()).isZero();
    }
}
