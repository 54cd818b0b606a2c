package hrms.hrmsbackend.service.auth;

import hrms.hrmsbackend.dto.request.auth.SignInRequestDto;
import hrms.hrmsbackend.dto.response.auth.PrincipalResponseDto;
import hrms.hrmsbackend.dto.response.auth.SignInResponseDto;
import hrms.hrmsbackend.service.permission.EssPrincipal;

public interface AuthService {
    // 직원 로그인 (사번 + 비밀번호)
    SignInResponseDto signIn(SignInRequestDto dto);

    // 관리자 로그인
    SignInResponseDto adminSignIn(SignInRequestDto dto);

    // 세션 갱신
    PrincipalResponseDto me(EssPrincipal principal);
}
