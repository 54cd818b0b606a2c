package hrms.hrmsbackend.dto.response.leave;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.RequestStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
public class LeaveRequestResponseDto {
    private Long id;
    private Long employeeId;
    private String employeeName;
    private String employeeCode;
    private Long leaveTypeId;
    private String leaveTypeCode;
    private String leaveTypeName;
    private LocalDate startDate;
    private LocalDate endDate;
    private Double totalDays;
    private Boolean halfDay;
    private String reason;
    private String mcUrl;
    private RequestStatus status;
    private Integer approvalLevel;
    private Long supervisorId;
    private LocalDateTime supervisorApprovedAt;
    private Long managerId;
    private LocalDateTime managerApprovedAt;
    private Long approvedBy;
    private LocalDateTime approvedAt;
    private String rejectionReason;
    private Boolean autoApproved;
    private LocalDateTime createdAt;

    public static LeaveRequestResponseDto fromEntity(LeaveRequest request, LeaveType type, Employee employee) {
        return LeaveRequestResponseDto.builder()
                .id(request.getId())
                .employeeId(request.getEmployeeId())
                .employeeName(employee != null ? employee.getName() : null)
                .employeeCode(employee != null ? employee.getEmployeeCode() : null)
                .leaveTypeId(request.getLeaveTypeId())
                .leaveTypeCode(type != null ? type.getCode() : null)
                .leaveTypeName(type != null ? type.getName() : null)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .totalDays(request.getTotalDays())
                .halfDay(request.getHalfDay())
                .reason(request.getReason())
                .mcUrl(request.getMcUrl())
                .status(request.getStatus())
                .approvalLevel(request.getApprovalLevel())
                .supervisorId(request.getSupervisorId())
                .supervisorApprovedAt(request.getSupervisorApprovedAt())
                .managerId(request.getManagerId())
                .managerApprovedAt(request.getManagerApprovedAt())
                .approvedBy(request.getApprovedBy())
                .approvedAt(request.getApprovedAt())
                .rejectionReason(request.getRejectionReason())
                .autoApproved(request.isAutoApproved())
                .createdAt(request.getCreatedAt())
                .build();
    }
}
