package hrms.hrmsbackend.dto.response.schedule;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.ExtraShiftRequest;
import hrms.hrmsbackend.enums.RequestStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Data
@Builder
public class ExtraShiftResponseDto {
    private Long id;
    private Long employeeId;
    private String employeeName;
    private LocalDate requestDate;
    private LocalTime shiftStart;
    private LocalTime shiftEnd;
    private String reason;
    private RequestStatus status;
    private Integer approvalLevel;
    private String rejectionReason;
    private Long scheduleId;
    private LocalDateTime createdAt;

    public static ExtraShiftResponseDto fromEntity(ExtraShiftRequest request, Employee employee) {
        return ExtraShiftResponseDto.builder()
                .id(request.getId())
                .employeeId(request.getEmployeeId())
                .employeeName(employee != null ? employee.getName() : null)
                .requestDate(request.getRequestDate())
                .shiftStart(request.getShiftStart())
                .shiftEnd(request.getShiftEnd())
                .reason(request.getReason())
                .status(request.getStatus())
                .approvalLevel(request.getApprovalLevel())
                .rejectionReason(request.getRejectionReason())
                .scheduleId(request.getScheduleId())
                .createdAt(request.getCreatedAt())
                .build();
    }
}
