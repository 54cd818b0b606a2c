package hrms.hrmsbackend.entity.mysql.company;

import hrms.hrmsbackend.enums.GroupingType;
import hrms.hrmsbackend.enums.OtRoundingUnit;
import hrms.hrmsbackend.enums.RoundingDirection;
import hrms.hrmsbackend.enums.WorkingWeek;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 회사 및 회사별 설정 (연차 반올림, 근무 주간, OT 규칙, 이월 정책)
 */
@Entity
@Table(name = "company")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "code", length = 20)
    private String code;

    // 첫 직원 등록 이후 변경 불가
    @Enumerated(EnumType.STRING)
    @Column(name = "grouping_type", nullable = false, updatable = false, length = 20)
    private GroupingType groupingType;

    @Enumerated(EnumType.STRING)
    @Column(name = "leave_proration_rounding", length = 10)
    @Builder.Default
    private RoundingDirection leaveProrationRounding = RoundingDirection.NEAREST;

    @Enumerated(EnumType.STRING)
    @Column(name = "working_week", length = 10)
    private WorkingWeek workingWeek; // null 이면 grouping_type 기본값

    @Column(name = "leave_carry_forward_enabled")
    @Builder.Default
    private Boolean leaveCarryForwardEnabled = false;

    @Column(name = "leave_carry_forward_max_days")
    @Builder.Default
    private Double leaveCarryForwardMaxDays = 5.0;

    @Column(name = "ot_threshold_hours")
    @Builder.Default
    private Double otThresholdHours = 8.0;

    @Column(name = "ot_normal_multiplier")
    @Builder.Default
    private Double otNormalMultiplier = 1.5;

    @Column(name = "ot_weekend_multiplier")
    @Builder.Default
    private Double otWeekendMultiplier = 1.5;

    @Column(name = "ot_ph_multiplier")
    @Builder.Default
    private Double otPublicHolidayMultiplier = 2.0;

    @Enumerated(EnumType.STRING)
    @Column(name = "ot_rounding_unit", length = 20)
    @Builder.Default
    private OtRoundingUnit otRoundingUnit = OtRoundingUnit.MINUTE;

    @Enumerated(EnumType.STRING)
    @Column(name = "ot_rounding_direction", length = 10)
    @Builder.Default
    private RoundingDirection otRoundingDirection = RoundingDirection.NEAREST;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isOutletBased() {
        return groupingType == GroupingType.OUTLET;
    }

    public WorkingWeek getEffectiveWorkingWeek() {
        return workingWeek != null ? workingWeek : WorkingWeek.defaultFor(groupingType);
    }
}
