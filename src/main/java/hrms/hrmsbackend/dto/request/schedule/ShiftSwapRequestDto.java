package hrms.hrmsbackend.dto.request.schedule;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ShiftSwapRequestDto {
    private Long requesterShiftId;
    private Long targetId;
    private Long targetShiftId;

    @Size(max = 1000)
    private String reason;
}
