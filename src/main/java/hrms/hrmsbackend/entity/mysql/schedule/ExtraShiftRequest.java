package hrms.hrmsbackend.entity.mysql.schedule;

import hrms.hrmsbackend.entity.mysql.approval.ApprovableRequest;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 추가 근무 신청. 최종 승인 시 스케줄이 생성되어 schedule_id 로 연결된다.
 */
@Entity
@Table(name = "extra_shift_request", indexes = @Index(name = "idx_extra_shift_employee_date", columnList = "employee_id, request_date"))
@Getter
@Setter
@NoArgsConstructor
public class ExtraShiftRequest extends ApprovableRequest {

    @Column(name = "request_date", nullable = false, updatable = false)
    private LocalDate requestDate;

    @Column(name = "shift_start", nullable = false, updatable = false)
    private LocalTime shiftStart;

    @Column(name = "shift_end", nullable = false, updatable = false)
    private LocalTime shiftEnd;

    @Column(name = "reason", columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "schedule_id")
    private Long scheduleId;
}
