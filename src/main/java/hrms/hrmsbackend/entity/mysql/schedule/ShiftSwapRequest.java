package hrms.hrmsbackend.entity.mysql.schedule;

import hrms.hrmsbackend.enums.SwapStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "shift_swap_request", indexes = {
        @Index(name = "idx_swap_requester_shift", columnList = "requester_shift_id"),
        @Index(name = "idx_swap_target_shift", columnList = "target_shift_id")
})
@Getter
@Setter
@NoArgsConstructor
public class ShiftSwapRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "outlet_id", nullable = false)
    private Long outletId;

    @Column(name = "requester_id", nullable = false)
    private Long requesterId;

    @Column(name = "requester_shift_id", nullable = false)
    private Long requesterShiftId;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @Column(name = "target_shift_id", nullable = false)
    private Long targetShiftId;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private SwapStatus status = SwapStatus.PENDING_TARGET;

    @Column(name = "target_responded_at")
    private LocalDateTime targetRespondedAt;

    @Column(name = "supervisor_id")
    private Long supervisorId;

    @Column(name = "supervisor_decided_at")
    private LocalDateTime supervisorDecidedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
