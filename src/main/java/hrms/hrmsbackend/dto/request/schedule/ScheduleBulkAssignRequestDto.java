package hrms.hrmsbackend.dto.request.schedule;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class ScheduleBulkAssignRequestDto {

    @Valid
    @NotEmpty(message = "Assignments are required")
    private List<ScheduleAssignRequestDto> assignments;
}
