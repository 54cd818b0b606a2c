package hrms.hrmsbackend.dto.request.schedule;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class SwapResponseRequestDto {
    private String response; // accepted | rejected
}
