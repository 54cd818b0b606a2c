package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.dto.response.schedule.WeeklyValidationDto;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 주간(7일) 근무/휴무 집계와 휴무 없음 경고
 */
public final class WeeklyScheduleValidator {

    public static final int DAYS_IN_WEEK = 7;
    public static final int MAX_CONSECUTIVE_WITHOUT_REST = 6;
    public static final String NO_REST_DAY = "no rest day";

    private WeeklyScheduleValidator() {
    }

    public static List<WeeklyValidationDto> validate(LocalDate weekStart, List<Employee> employees, List<Schedule> schedules) {
        Map<Long, Map<LocalDate, Schedule>> byEmployee = new HashMap<>();
        for (Schedule schedule : schedules) {
            byEmployee.computeIfAbsent(schedule.getEmployeeId(), k -> new HashMap<>())
                    .put(schedule.getScheduleDate(), schedule);
        }

        List<WeeklyValidationDto> result = new ArrayList<>();
        for (Employee employee : employees) {
            result.add(summarize(weekStart, employee, byEmployee.getOrDefault(employee.getId(), Map.of())));
        }
        return result;
    }

    static WeeklyValidationDto summarize(LocalDate weekStart, Employee employee, Map<LocalDate, Schedule> days) {
        int work = 0;
        int off = 0;
        int unscheduled = 0;
        int run = 0;
        int maxRun = 0;

        for (int i = 0; i < DAYS_IN_WEEK; i++) {
            Schedule schedule = days.get(weekStart.plusDays(i));
            if (schedule == null) {
                unscheduled++;
                run = 0;
            } else if (schedule.isWorkingShift()) {
                work++;
                run++;
                maxRun = Math.max(maxRun, run);
            } else {
                // 휴무, 휴가
                off++;
                run = 0;
            }
        }

        return WeeklyValidationDto.builder()
                .employeeId(employee.getId())
                .employeeName(employee.getName())
                .workDays(work)
                .offDays(off)
                .unscheduledDays(unscheduled)
                .maxConsecutiveWork(maxRun)
                .warning(maxRun >= MAX_CONSECUTIVE_WITHOUT_REST && off == 0 ? NO_REST_DAY : null)
                .build();
    }
}
