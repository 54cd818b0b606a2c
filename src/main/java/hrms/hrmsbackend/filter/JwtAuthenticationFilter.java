package hrms.hrmsbackend.filter;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.provider.JwtProvider;
import hrms.hrmsbackend.repository.mysql.employee.AdminUserRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String ACCESS_TOKEN_COOKIE = "accessToken";
    public static final String COMPANY_CONTEXT_HEADER = "X-Company-Id";

    private final JwtProvider jwtProvider;
    private final EmployeeRepository employeeRepository;
    private final AdminUserRepository adminUserRepository;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestURI = request.getRequestURI();
        if (requestURI.startsWith("/v3/api-docs") || requestURI.startsWith("/swagger-ui")) {
            filterChain.doFilter(request, response);
            return;
        }
        try {
            String token = resolveToken(request);
            String subject = token != null ? jwtProvider.validate(token) : null;
            EssPrincipal principal = subject != null ? loadPrincipal(subject) : null;

            if (principal != null) {
                principal = principal.withCompanyContext(parseCompanyContext(request));

                AbstractAuthenticationToken authenticationToken = new UsernamePasswordAuthenticationToken(
                        principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + principal.getRole().name())));
                authenticationToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

                SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                securityContext.setAuthentication(authenticationToken);
                SecurityContextHolder.setContext(securityContext);
            }
        } catch (RuntimeException exception) {
            // 인증 실패는 익명 요청으로 처리, 보호된 경로는 EntryPoint 가 401 응답
            log.warn("JWT 인증 처리 실패: {}", exception.getMessage());
            SecurityContextHolder.clearContext();
        }
        filterChain.doFilter(request, response);
    }

    private EssPrincipal loadPrincipal(String subject) {
        if (subject.startsWith(JwtProvider.EMPLOYEE_SUBJECT_PREFIX)) {
            Long employeeId = Long.valueOf(subject.substring(JwtProvider.EMPLOYEE_SUBJECT_PREFIX.length()));
            return employeeRepository.findById(employeeId)
                    .filter(Employee::isActive)
                    .filter(e -> Boolean.TRUE.equals(e.getEssEnabled()))
                    .map(EssPrincipal::of)
                    .orElse(null);
        }
        if (subject.startsWith(JwtProvider.ADMIN_SUBJECT_PREFIX)) {
            Long adminId = Long.valueOf(subject.substring(JwtProvider.ADMIN_SUBJECT_PREFIX.length()));
            return adminUserRepository.findById(adminId)
                    .filter(a -> Boolean.TRUE.equals(a.getActive()))
                    .map(EssPrincipal::of)
                    .orElse(null);
        }
        return null;
    }

    // Authorization 헤더 우선, 없으면 accessToken 쿠키
    private String resolveToken(HttpServletRequest request) {
        String authorization = request.getHeader("Authorization");
        if (StringUtils.hasText(authorization) && authorization.startsWith("Bearer ")) {
            String token = authorization.substring(7).trim();
            return token.chars().filter(ch -> ch == '.').count() == 2 ? token : null;
        }
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (ACCESS_TOKEN_COOKIE.equals(cookie.getName()) && StringUtils.hasText(cookie.getValue())) {
                    return cookie.getValue();
                }
            }
        }
        return null;
    }

    private Long parseCompanyContext(HttpServletRequest request) {
        String header = request.getHeader(COMPANY_CONTEXT_HEADER);
        if (!StringUtils.hasText(header)) {
            return null;
        }
        try {
            return Long.valueOf(header.trim());
        } catch (NumberFormatException e) {
            log.warn("잘못된 {} 헤더 값: {}", COMPANY_CONTEXT_HEADER, header);
            return null;
        }
    }
}
