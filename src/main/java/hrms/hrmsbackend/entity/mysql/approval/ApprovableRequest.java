package hrms.hrmsbackend.entity.mysql.approval;

import hrms.hrmsbackend.enums.RequestStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 단계별 승인(1 → 2 → 3)을 거치는 요청의 공통 컬럼.
 * 생성 이후에는 상태, 승인 단계, 단계별 승인자, 반려 사유만 변경된다.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class ApprovableRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private Long employeeId;

    @Column(name = "company_id", nullable = false, updatable = false)
    private Long companyId;

    @Column(name = "outlet_id", updatable = false)
    private Long outletId;

    @Column(name = "department_id", updatable = false)
    private Long departmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RequestStatus status = RequestStatus.PENDING;

    @Column(name = "approval_level", nullable = false)
    private Integer approvalLevel = 1;

    @Column(name = "supervisor_id")
    private Long supervisorId;

    @Column(name = "supervisor_approved_at")
    private LocalDateTime supervisorApprovedAt;

    @Column(name = "manager_id")
    private Long managerId;

    @Column(name = "manager_approved_at")
    private LocalDateTime managerApprovedAt;

    @Column(name = "approved_by")
    private Long approvedBy; // 최종 승인 관리자 (admin_user.id)

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "rejected_by")
    private Long rejectedBy;

    @Column(name = "rejected_by_role", length = 20)
    private String rejectedByRole;

    @Column(name = "rejected_at")
    private LocalDateTime rejectedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "auto_approved")
    private Boolean autoApproved = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isAutoApproved() {
        return Boolean.TRUE.equals(autoApproved);
    }
}
