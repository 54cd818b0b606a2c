package hrms.hrmsbackend.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 반려 요청 (사유는 요청 종류에 따라 필수)
 */
@Getter
@Setter
@NoArgsConstructor
public class RejectRequestDto {

    @Size(max = 1000)
    private String reason;
}
