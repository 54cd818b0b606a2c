package hrms.hrmsbackend.dto.request.schedule;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
public class ScheduleAssignRequestDto {

    @NotNull(message = "Employee is required")
    private Long employeeId;

    @NotNull(message = "Schedule date is required")
    private LocalDate scheduleDate;

    @NotNull(message = "Shift template is required")
    private Long shiftTemplateId;
}
