package hrms.hrmsbackend.config;

import hrms.hrmsbackend.entity.mysql.employee.AdminUser;
import hrms.hrmsbackend.enums.Role;
import hrms.hrmsbackend.repository.mysql.employee.AdminUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 애플리케이션 시작 시 super_admin 계정이 없으면 생성
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SuperAdminInitializer implements ApplicationRunner {

    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${super-admin.username:}")
    private String superAdminUsername;

    @Value("${super-admin.password:}")
    private String superAdminPassword;

    @Override
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(superAdminUsername) || !StringUtils.hasText(superAdminPassword)) {
            log.info("super-admin 설정이 없어 초기 계정 생성을 건너뜁니다.");
            return;
        }
        try {
            if (adminUserRepository.findByUsername(superAdminUsername).isPresent()) {
                return;
            }
            // company_id null = 전 회사 관리
            AdminUser superAdmin = AdminUser.builder()
                    .username(superAdminUsername)
                    .name("Super Admin")
                    .passwordHash(passwordEncoder.encode(superAdminPassword))
                    .role(Role.SUPER_ADMIN)
                    .build();
            adminUserRepository.save(superAdmin);
            log.info("super_admin 계정 생성: {}", superAdminUsername);
        } catch (DataAccessException e) {
            log.error("super_admin 초기화 중 오류 발생", e);
        }
    }
}
