package hrms.hrmsbackend.dto.request.auth;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
// 로그인 요청 객체
public class SignInRequestDto {
    @NotBlank
    private String id; // 사번 또는 관리자 username

    @NotBlank
    private String passwd;
}
