package hrms.hrmsbackend.entity.mysql.schedule;

import hrms.hrmsbackend.enums.ScheduleStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 직원별 일자 근무 배정. (employee_id, schedule_date) 당 최대 1건.
 */
@Entity
@Table(name = "schedule",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "schedule_date"}),
        indexes = {
                @Index(name = "idx_schedule_outlet_date", columnList = "outlet_id, schedule_date"),
                @Index(name = "idx_schedule_department_date", columnList = "department_id, schedule_date")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Schedule {

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

    @Column(name = "schedule_date", nullable = false)
    private LocalDate scheduleDate;

    @Column(name = "shift_template_id")
    private Long shiftTemplateId;

    @Column(name = "shift_start")
    private LocalTime shiftStart;

    @Column(name = "shift_end")
    private LocalTime shiftEnd;

    @Column(name = "break_duration")
    @Builder.Default
    private Integer breakDuration = 60;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20)
    @Builder.Default
    private ScheduleStatus status = ScheduleStatus.SCHEDULED;

    @Column(name = "is_public_holiday")
    @Builder.Default
    private Boolean publicHoliday = false;

    @Column(name = "created_by")
    private Long createdBy;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isWorkingShift() {
        return status == ScheduleStatus.SCHEDULED;
    }
}
