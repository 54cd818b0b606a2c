package hrms.hrmsbackend.dto.response.attendance;

import hrms.hrmsbackend.entity.mysql.attendance.ClockInRecord;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.OtDayType;
import hrms.hrmsbackend.service.attendance.OvertimeCalculator;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
public class ClockInRecordResponseDto {
    private Long id;
    private Long employeeId;
    private String employeeName;
    private String employeeCode;
    private Long outletId;
    private Long departmentId;
    private LocalDate workDate;
    private LocalDateTime clockIn1;
    private LocalDateTime clockOut1;
    private LocalDateTime clockIn2;
    private LocalDateTime clockOut2;
    private String locationIn1;
    private String locationOut2;
    private Boolean hasSchedule;
    private Long scheduleId;
    private Integer totalWorkMinutes;
    private Integer totalBreakMinutes;
    private String totalHours;
    private Integer otMinutes;
    private String otHours;
    private Boolean otFlagged;
    private OtDayType otDayType;
    private Double otMultiplier;
    private Boolean otApproved;
    private Long otApprovedBy;
    private LocalDateTime otApprovedAt;
    private String otRejectionReason;

    public static ClockInRecordResponseDto fromEntity(ClockInRecord record) {
        return fromEntity(record, null);
    }

    public static ClockInRecordResponseDto fromEntity(ClockInRecord record, Employee employee) {
        return ClockInRecordResponseDto.builder()
                .id(record.getId())
                .employeeId(record.getEmployeeId())
                .employeeName(employee != null ? employee.getName() : null)
                .employeeCode(employee != null ? employee.getEmployeeCode() : null)
                .outletId(record.getOutletId())
                .departmentId(record.getDepartmentId())
                .workDate(record.getWorkDate())
                .clockIn1(record.getClockIn1())
                .clockOut1(record.getClockOut1())
                .clockIn2(record.getClockIn2())
                .clockOut2(record.getClockOut2())
                .locationIn1(record.getLocationIn1())
                .locationOut2(record.getLocationOut2())
                .hasSchedule(record.getHasSchedule())
                .scheduleId(record.getScheduleId())
                .totalWorkMinutes(record.getTotalWorkMinutes())
                .totalBreakMinutes(record.getTotalBreakMinutes())
                .totalHours(OvertimeCalculator.formatHours(record.getTotalWorkMinutes()))
                .otMinutes(record.getOtMinutes())
                .otHours(OvertimeCalculator.formatHours(record.getOtMinutes()))
                .otFlagged(record.getOtFlagged())
                .otDayType(record.getOtDayType())
                .otMultiplier(record.getOtMultiplier())
                .otApproved(record.getOtApproved())
                .otApprovedBy(record.getOtApprovedBy())
                .otApprovedAt(record.getOtApprovedAt())
                .otRejectionReason(record.getOtRejectionReason())
                .build();
    }
}
