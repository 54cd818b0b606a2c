package hrms.hrmsbackend.entity.mysql.leave;

import hrms.hrmsbackend.enums.Gender;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "leave_type", indexes = @Index(name = "idx_leave_type_company", columnList = "company_id"))
public class LeaveType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id")
    private Long companyId; // null = 전사 공통

    @Column(name = "code", nullable = false, length = 10)
    private String code; // AL, SL, HL, MAT, PAT, CL, EL, UL ...

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "is_paid")
    @Builder.Default
    private Boolean paid = true;

    @Column(name = "requires_attachment")
    @Builder.Default
    private Boolean requiresAttachment = false;

    // 출산/배우자출산 휴가처럼 달력일 기준으로 계산
    @Column(name = "is_consecutive")
    @Builder.Default
    private Boolean consecutive = false;

    @Column(name = "max_occurrences")
    private Integer maxOccurrences;

    @Column(name = "min_service_days")
    private Integer minServiceDays;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender_restriction", length = 10)
    private Gender genderRestriction;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "leave_entitlement_rule", joinColumns = @JoinColumn(name = "leave_type_id"))
    @OrderBy("minServiceYears ASC")
    @Builder.Default
    private List<EntitlementRule> entitlementRules = new ArrayList<>();

    @Column(name = "default_days_per_year")
    @Builder.Default
    private Double defaultDaysPerYear = 0.0;

    @Column(name = "carries_forward")
    @Builder.Default
    private Boolean carriesForward = false;

    @Column(name = "max_carry_forward")
    private Double maxCarryForward;

    @Column(name = "is_active")
    @Builder.Default
    private Boolean active = true;

    public boolean isPaidType() {
        return Boolean.TRUE.equals(paid);
    }

    public boolean isAttachmentRequired() {
        return Boolean.TRUE.equals(requiresAttachment);
    }

    public boolean isConsecutiveType() {
        return Boolean.TRUE.equals(consecutive);
    }
}
