package hrms.hrmsbackend.dto.response.claim;

import hrms.hrmsbackend.entity.mysql.claim.Claim;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.RequestStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
public class ClaimResponseDto {
    private Long id;
    private Long employeeId;
    private String employeeName;
    private LocalDate claimDate;
    private String category;
    private String description;
    private BigDecimal amount;
    private String receiptUrl;
    private RequestStatus status;
    private Integer approvalLevel;
    private String rejectionReason;
    private Boolean autoApproved;
    private LocalDateTime approvedAt;
    private LocalDateTime createdAt;

    public static ClaimResponseDto fromEntity(Claim claim, Employee employee) {
        return ClaimResponseDto.builder()
                .id(claim.getId())
                .employeeId(claim.getEmployeeId())
                .employeeName(employee != null ? employee.getName() : null)
                .claimDate(claim.getClaimDate())
                .category(claim.getCategory())
                .description(claim.getDescription())
                .amount(claim.getAmount())
                .receiptUrl(claim.getReceiptUrl())
                .status(claim.getStatus())
                .approvalLevel(claim.getApprovalLevel())
                .rejectionReason(claim.getRejectionReason())
                .autoApproved(claim.isAutoApproved())
                .approvedAt(claim.getApprovedAt())
                .createdAt(claim.getCreatedAt())
                .build();
    }
}
