package hrms.hrmsbackend.dto.response.schedule;

import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.entity.mysql.schedule.ShiftTemplate;
import hrms.hrmsbackend.enums.ScheduleStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
public class ScheduleResponseDto {
    private Long id;
    private Long employeeId;
    private String employeeName;
    private Long outletId;
    private Long departmentId;
    private LocalDate scheduleDate;
    private Long shiftTemplateId;
    private String shiftCode;
    private String shiftName;
    private String shiftColor;
    private LocalTime shiftStart;
    private LocalTime shiftEnd;
    private Integer breakDuration;
    private ScheduleStatus status;
    private Boolean publicHoliday;

    public static ScheduleResponseDto fromEntity(Schedule schedule, ShiftTemplate template, String employeeName) {
        return ScheduleResponseDto.builder()
                .id(schedule.getId())
                .employeeId(schedule.getEmployeeId())
                .employeeName(employeeName)
                .outletId(schedule.getOutletId())
                .departmentId(schedule.getDepartmentId())
                .scheduleDate(schedule.getScheduleDate())
                .shiftTemplateId(schedule.getShiftTemplateId())
                .shiftCode(template != null ? template.getCode() : null)
                .shiftName(template != null ? template.getName() : null)
                .shiftColor(template != null ? template.getColor() : null)
                .shiftStart(schedule.getShiftStart())
                .shiftEnd(schedule.getShiftEnd())
                .breakDuration(schedule.getBreakDuration())
                .status(schedule.getStatus())
                .publicHoliday(schedule.getPublicHoliday())
                .build();
    }
}
