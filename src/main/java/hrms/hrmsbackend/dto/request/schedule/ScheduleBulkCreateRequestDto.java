package hrms.hrmsbackend.dto.request.schedule;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

@Getter
@Setter
@NoArgsConstructor
public class ScheduleBulkCreateRequestDto {

    @NotNull(message = "Employee is required")
    private Long employeeId;

    @NotNull(message = "Start date is required")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    private LocalDate endDate;

    @NotEmpty(message = "Days of week are required")
    private Set<DayOfWeek> daysOfWeek;

    private Long shiftTemplateId;
    private LocalTime shiftStart;
    private LocalTime shiftEnd;
    private Integer breakDuration;
}
