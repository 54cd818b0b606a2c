package hrms.hrmsbackend.dto.request.schedule;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 스케줄 생성/수정. 템플릿이 있으면 시간은 템플릿 값을 쓴다.
 */
@Getter
@Setter
@NoArgsConstructor
public class ScheduleCreateRequestDto {
    private Long employeeId;
    private LocalDate scheduleDate;
    private Long shiftTemplateId;
    private LocalTime shiftStart;
    private LocalTime shiftEnd;
    private Integer breakDuration;
}
