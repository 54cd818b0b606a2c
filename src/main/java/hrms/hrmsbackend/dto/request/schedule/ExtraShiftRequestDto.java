package hrms.hrmsbackend.dto.request.schedule;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

@Getter
@Setter
@NoArgsConstructor
public class ExtraShiftRequestDto {
    private LocalDate requestDate;
    private LocalTime shiftStart;
    private LocalTime shiftEnd;

    @Size(max = 1000)
    private String reason;
}
