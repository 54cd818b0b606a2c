package hrms.hrmsbackend.dto.request.attendance;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ClockActionRequestDto {

    @NotBlank(message = "Action is required")
    private String action; // clock_in_1, clock_out_1, clock_in_2, clock_out_2

    private String photo; // 업로드된 사진 URL

    private Double latitude;
    private Double longitude;
}
