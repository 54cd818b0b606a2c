package hrms.hrmsbackend.dto.response.auth;

import hrms.hrmsbackend.common.ResponseCode;
import hrms.hrmsbackend.common.ResponseMessage;
import hrms.hrmsbackend.dto.response.ResponseDto;
import lombok.Getter;

@Getter
public class SignInResponseDto extends ResponseDto {
    private final String token;
    private final long expiresIn;
    private final PrincipalResponseDto user;

    private SignInResponseDto(String token, long expiresIn, PrincipalResponseDto user) {
        super(ResponseCode.SUCCESS, ResponseMessage.SUCCESS);
        this.token = token;
        this.expiresIn = expiresIn;
        this.user = user;
    }

    // 로그인 성공 응답
    public static SignInResponseDto success(String token, long expiresIn, PrincipalResponseDto user) {
        return new SignInResponseDto(token, expiresIn, user);
    }
}
