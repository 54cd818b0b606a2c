package hrms.hrmsbackend.entity.mysql.attendance;

import hrms.hrmsbackend.enums.OtDayType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 직원별 일일 출퇴근 기록. (employee_id, work_date) 당 1건이며 각 슬롯은 한 번만 기록된다.
 */
@Entity
@Table(name = "clock_in_record",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "work_date"}),
        indexes = @Index(name = "idx_clock_in_ot", columnList = "ot_flagged, ot_approved"))
@Getter
@Setter
@NoArgsConstructor
public class ClockInRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "outlet_id")
    private Long outletId;

    @Column(name = "department_id")
    private Long departmentId;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(name = "clock_in_1")
    private LocalDateTime clockIn1;

    @Column(name = "clock_out_1")
    private LocalDateTime clockOut1;

    @Column(name = "clock_in_2")
    private LocalDateTime clockIn2;

    @Column(name = "clock_out_2")
    private LocalDateTime clockOut2;

    // 펀치별 사진/위치
    @Column(name = "photo_in_1")
    private String photoIn1;
    @Column(name = "photo_out_1")
    private String photoOut1;
    @Column(name = "photo_in_2")
    private String photoIn2;
    @Column(name = "photo_out_2")
    private String photoOut2;

    @Column(name = "location_in_1")
    private String locationIn1;
    @Column(name = "location_out_1")
    private String locationOut1;
    @Column(name = "location_in_2")
    private String locationIn2;
    @Column(name = "location_out_2")
    private String locationOut2;

    @Column(name = "has_schedule")
    private Boolean hasSchedule = false;

    @Column(name = "schedule_id")
    private Long scheduleId;

    @Column(name = "total_work_minutes")
    private Integer totalWorkMinutes = 0;

    @Column(name = "total_break_minutes")
    private Integer totalBreakMinutes = 0;

    @Column(name = "ot_minutes")
    private Integer otMinutes = 0;

    @Column(name = "ot_flagged")
    private Boolean otFlagged = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "ot_day_type", length = 20)
    private OtDayType otDayType;

    @Column(name = "ot_multiplier")
    private Double otMultiplier;

    @Column(name = "ot_approved")
    private Boolean otApproved; // null = 미결정

    @Column(name = "ot_approved_by")
    private Long otApprovedBy;

    @Column(name = "ot_approved_at")
    private LocalDateTime otApprovedAt;

    @Column(name = "ot_rejection_reason", columnDefinition = "TEXT")
    private String otRejectionReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isOtFlagged() {
        return Boolean.TRUE.equals(otFlagged);
    }
}
