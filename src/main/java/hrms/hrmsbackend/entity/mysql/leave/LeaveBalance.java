package hrms.hrmsbackend.entity.mysql.leave;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "leave_balance",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "leave_type_id", "year"})
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaveBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "leave_type_id", nullable = false)
    private Long leaveTypeId;

    @Column(name = "year", nullable = false)
    private Integer year;

    @Column(name = "entitled_days")
    @Builder.Default
    private Double entitledDays = 0.0;

    @Column(name = "carried_forward")
    @Builder.Default
    private Double carriedForward = 0.0;

    @Column(name = "used_days")
    @Builder.Default
    private Double usedDays = 0.0;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 총 사용 가능 일수 (부여 + 이월)
     */
    public double getTotalDays() {
        return nz(entitledDays) + nz(carriedForward);
    }

    /**
     * 남은 일수
     */
    public double getAvailableDays() {
        return getTotalDays() - nz(usedDays);
    }

    private static double nz(Double value) {
        return value != null ? value : 0.0;
    }
}
