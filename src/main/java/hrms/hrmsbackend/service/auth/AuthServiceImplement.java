package hrms.hrmsbackend.service.auth;

import hrms.hrmsbackend.dto.request.auth.SignInRequestDto;
import hrms.hrmsbackend.dto.response.auth.PrincipalResponseDto;
import hrms.hrmsbackend.dto.response.auth.SignInResponseDto;
import hrms.hrmsbackend.entity.mysql.employee.AdminUser;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.provider.JwtProvider;
import hrms.hrmsbackend.repository.mysql.employee.AdminUserRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImplement implements AuthService {

    private static final String SIGN_IN_FAIL = "Invalid credentials";

    private final EmployeeRepository employeeRepository;
    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtProvider jwtProvider;
    private final PermissionKernel permissionKernel;

    @Override
    @Transactional(readOnly = true)
    public SignInResponseDto signIn(SignInRequestDto dto) {
        Employee employee = employeeRepository.findByEmployeeCode(dto.getId().trim())
                .filter(e -> e.getPasswordHash() != null && passwordEncoder.matches(dto.getPasswd(), e.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("로그인 실패 - employeeCode: {}", dto.getId());
                    return EssException.unauthenticated(SIGN_IN_FAIL);
                });
        if (!employee.isActive() || !Boolean.TRUE.equals(employee.getEssEnabled())) {
            log.warn("ESS 비활성 계정 로그인 시도 - employeeCode: {}", employee.getEmployeeCode());
            throw EssException.forbidden("Self-service access is not enabled for your account");
        }

        EssPrincipal principal = EssPrincipal.of(employee);
        String token = jwtProvider.create(JwtProvider.EMPLOYEE_SUBJECT_PREFIX + employee.getId(), principal.getRole().getValue());
        log.info("로그인 성공 - employeeCode: {}", employee.getEmployeeCode());
        return SignInResponseDto.success(token, jwtProvider.getAccessTokenExpirationTime(), me(principal));
    }

    @Override
    @Transactional(readOnly = true)
    public SignInResponseDto adminSignIn(SignInRequestDto dto) {
        AdminUser admin = adminUserRepository.findByUsername(dto.getId().trim())
                .filter(a -> Boolean.TRUE.equals(a.getActive()))
                .filter(a -> passwordEncoder.matches(dto.getPasswd(), a.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("관리자 로그인 실패 - username: {}", dto.getId());
                    return EssException.unauthenticated(SIGN_IN_FAIL);
                });

        EssPrincipal principal = EssPrincipal.of(admin);
        String token = jwtProvider.create(JwtProvider.ADMIN_SUBJECT_PREFIX + admin.getId(), principal.getRole().getValue());
        log.info("관리자 로그인 성공 - username: {}, role: {}", admin.getUsername(), admin.getRole());
        return SignInResponseDto.success(token, jwtProvider.getAccessTokenExpirationTime(), me(principal));
    }

    @Override
    @Transactional(readOnly = true)
    public PrincipalResponseDto me(EssPrincipal principal) {
        return PrincipalResponseDto.of(principal, permissionKernel.capabilities(principal));
    }
}
