package hrms.hrmsbackend.entity.mysql.employee;

import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.EmployeeStatus;
import hrms.hrmsbackend.enums.EmploymentStatus;
import hrms.hrmsbackend.enums.EmploymentType;
import hrms.hrmsbackend.enums.Gender;
import hrms.hrmsbackend.enums.WorkType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "employee", indexes = {
        @Index(name = "idx_employee_company", columnList = "company_id"),
        @Index(name = "idx_employee_outlet", columnList = "outlet_id"),
        @Index(name = "idx_employee_department", columnList = "department_id"),
        @Index(name = "idx_employee_code", columnList = "employee_code", unique = true)
})
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "employee_code", nullable = false, length = 30)
    private String employeeCode; // 사번

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "password_hash")
    private String passwordHash;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    // 회사 grouping_type 에 맞는 쪽만 값이 있다
    @Column(name = "outlet_id")
    private Long outletId;

    @Column(name = "department_id")
    private Long departmentId;

    @Column(name = "position_id")
    private Long positionId;

    @Column(name = "position", length = 50)
    private String position; // 직책 자유 입력값

    @Enumerated(EnumType.STRING)
    @Column(name = "employee_role", length = 20)
    @Builder.Default
    private EmployeeRole employeeRole = EmployeeRole.STAFF;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20)
    @Builder.Default
    private EmployeeStatus status = EmployeeStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "employment_status", length = 20)
    private EmploymentStatus employmentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "work_type", length = 20)
    @Builder.Default
    private WorkType workType = WorkType.FULL_TIME;

    @Enumerated(EnumType.STRING)
    @Column(name = "employment_type", length = 20)
    private EmploymentType employmentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", length = 10)
    private Gender gender;

    @Column(name = "join_date")
    private LocalDate joinDate;

    @Column(name = "last_working_day")
    private LocalDate lastWorkingDay;

    @Column(name = "ess_enabled")
    @Builder.Default
    private Boolean essEnabled = true;

    @Column(name = "clock_in_required")
    @Builder.Default
    private Boolean clockInRequired = true;

    // 사무실형 회사에서 스케줄/OT 승인을 맡는 지정 매니저
    @Column(name = "schedule_manager")
    @Builder.Default
    private Boolean scheduleManager = false;

    @Column(name = "basic_salary", precision = 12, scale = 2)
    private BigDecimal basicSalary;

    private String phone;
    private String email;
    private String address;

    @Column(name = "emergency_contact_name", length = 100)
    private String emergencyContactName;

    @Column(name = "emergency_contact_phone", length = 30)
    private String emergencyContactPhone;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == EmployeeStatus.ACTIVE;
    }

    /**
     * 파트타임 여부 (근무형태 또는 고용형태 기준). OT 대상에서 제외된다.
     */
    public boolean isPartTime() {
        return workType == WorkType.PART_TIME || employmentType == EmploymentType.PART_TIME;
    }

    public boolean isScheduleManager() {
        return Boolean.TRUE.equals(scheduleManager);
    }
}
