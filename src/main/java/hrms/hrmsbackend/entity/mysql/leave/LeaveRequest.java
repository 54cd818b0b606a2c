package hrms.hrmsbackend.entity.mysql.leave;

import hrms.hrmsbackend.entity.mysql.approval.ApprovableRequest;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "leave_request", indexes = {
        @Index(name = "idx_leave_request_employee", columnList = "employee_id, status"),
        @Index(name = "idx_leave_request_dates", columnList = "start_date, end_date")
})
@Getter
@Setter
@NoArgsConstructor
public class LeaveRequest extends ApprovableRequest {

    @Column(name = "leave_type_id", nullable = false, updatable = false)
    private Long leaveTypeId;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Column(name = "total_days", nullable = false, updatable = false)
    private Double totalDays;

    @Column(name = "reason", columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "mc_url", updatable = false)
    private String mcUrl; // 진단서 등 첨부 URL

    @Column(name = "half_day", updatable = false)
    private Boolean halfDay = false;

    @Column(name = "auto_approved_at")
    private LocalDateTime autoApprovedAt;

    // 차감 시점의 연도. 취소/되돌리기 시 같은 잔여 행으로 복원한다
    @Column(name = "balance_year")
    private Integer balanceYear;
}
