package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.dto.response.schedule.WeeklyValidationDto;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.enums.ScheduleStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WeeklyScheduleValidator 단위 테스트")
class WeeklyScheduleValidatorTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 6, 2);

    private final Employee alice = Employee.builder().id(1L).name("Alice").build();
    private final Employee bob = Employee.builder().id(2L).name("Bob").build();

    private static Schedule day(Long employeeId, int offset, ScheduleStatus status) {
        return Schedule.builder()
                .employeeId(employeeId)
                .scheduleDate(MONDAY.plusDays(offset))
                .status(status)
                .build();
    }

    @Test
    @DisplayName("7일 연속 근무면 휴무 없음 경고")
    void sevenWorkingDays() {
        List<Schedule> schedules = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            schedules.add(day(1L, i, ScheduleStatus.SCHEDULED));
        }

        List<WeeklyValidationDto> result = WeeklyScheduleValidator.validate(MONDAY, List.of(alice), schedules);

        assertThat(result).hasSize(1);
        WeeklyValidationDto dto = result.get(0);
        assertThat(dto.getWorkDays()).isEqualTo(7);
        assertThat(dto.getOffDays()).isZero();
        assertThat(dto.getMaxConsecutiveWork()).isEqualTo(7);
        assertThat(dto.getWarning()).isEqualTo(WeeklyScheduleValidator.NO_REST_DAY);
    }

    @Test
    @DisplayName("휴무가 하루라도 있으면 경고 없음")
    void restDayClearsWarning() {
        List<Schedule> schedules = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            schedules.add(day(1L, i, ScheduleStatus.SCHEDULED));
        }
        schedules.add(day(1L, 6, ScheduleStatus.OFF));

        WeeklyValidationDto dto = WeeklyScheduleValidator.validate(MONDAY, List.of(alice), schedules).get(0);

        assertThat(dto.getWorkDays()).isEqualTo(6);
        assertThat(dto.getOffDays()).isEqualTo(1);
        assertThat(dto.getMaxConsecutiveWork()).isEqualTo(6);
        assertThat(dto.getWarning()).isNull();
    }

    @Test
    @DisplayName("휴가일은 휴무로, 미배정일은 따로 집계")
    void leaveAndUnscheduled() {
        List<Schedule> schedules = List.of(
                day(2L, 0, ScheduleStatus.SCHEDULED),
                day(2L, 1, ScheduleStatus.ON_LEAVE),
                day(2L, 2, ScheduleStatus.SCHEDULED),
                day(2L, 3, ScheduleStatus.SCHEDULED));

        List<WeeklyValidationDto> result = WeeklyScheduleValidator.validate(MONDAY, List.of(alice, bob), schedules);

        WeeklyValidationDto aliceRow = result.get(0);
        assertThat(aliceRow.getUnscheduledDays()).isEqualTo(7);
        assertThat(aliceRow.getWarning()).isNull();

        WeeklyValidationDto bobRow = result.get(1);
        assertThat(bobRow.getEmployeeName()).isEqualTo("Bob");
        assertThat(bobRow.getWorkDays()).isEqualTo(3);
        assertThat(bobRow.getOffDays()).isEqualTo(1);
        assertThat(bobRow.getUnscheduledDays()).isEqualTo(3);
        assertThat(bobRow.getMaxConsecutiveWork()).isEqualTo(2);
    }

    @Test
    @DisplayName("주 범위 밖 스케줄은 무시")
    void ignoresOtherWeeks() {
        List<Schedule> schedules = List.of(day(1L, 7, ScheduleStatus.SCHEDULED), day(1L, -1, ScheduleStatus.SCHEDULED));

        WeeklyValidationDto dto = WeeklyScheduleValidator.validate(MONDAY, List.of(alice), schedules).get(0);

        assertThat(dto.getWorkDays()).isZero();
        assertThat(dto.getUnscheduledDays()).isEqualTo(WeeklyScheduleValidator.DAYS_IN_WEEK);
    }
}
