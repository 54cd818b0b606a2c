package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.common.ResponseMessage;
import hrms.hrmsbackend.dto.request.auth.SignInRequestDto;
import hrms.hrmsbackend.dto.response.ResponseDto;
import hrms.hrmsbackend.dto.response.auth.PrincipalResponseDto;
import hrms.hrmsbackend.dto.response.auth.SignInResponseDto;
import hrms.hrmsbackend.filter.JwtAuthenticationFilter;
import hrms.hrmsbackend.service.auth.AuthService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @Value("${ess.cookie.secure:true}")
    private boolean secureCookie;

    // 직원 로그인 (사번)
    @PostMapping("/sign-in")
    public ResponseEntity<SignInResponseDto> signIn(@RequestBody @Valid SignInRequestDto requestBody,
                                                    HttpServletResponse response) {
        SignInResponseDto body = authService.signIn(requestBody);
        setTokenCookie(response, body.getToken(), body.getExpiresIn());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/admin/sign-in")
    public ResponseEntity<SignInResponseDto> adminSignIn(@RequestBody @Valid SignInRequestDto requestBody,
                                                         HttpServletResponse response) {
        SignInResponseDto body = authService.adminSignIn(requestBody);
        setTokenCookie(response, body.getToken(), body.getExpiresIn());
        return ResponseEntity.ok(body);
    }

    // 세션 갱신: 현재 주체와 권한 플래그
    @GetMapping("/me")
    public ResponseEntity<PrincipalResponseDto> me(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(authService.me(principal));
    }

    @PostMapping("/logout")
    public ResponseEntity<ResponseDto> logout(HttpServletResponse response) {
        setTokenCookie(response, "", 0);
        return ResponseEntity.ok(ResponseDto.success(ResponseMessage.LOGOUT_SUCCESS));
    }

    private void setTokenCookie(HttpServletResponse response, String token, long maxAgeSeconds) {
        ResponseCookie cookie = ResponseCookie.from(JwtAuthenticationFilter.ACCESS_TOKEN_COOKIE, token)
                .httpOnly(true)
                .secure(secureCookie)
                .path("/")
                .sameSite("Strict")
                .maxAge(maxAgeSeconds)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
