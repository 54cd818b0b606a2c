package hrms.hrmsbackend.enums;

import lombok.Getter;

/**
 * 인증 주체(principal)의 역할. 직원 계정과 관리자 계정을 구분한다.
 */
@Getter
public enum Role {
    EMPLOYEE("employee"),
    ADMIN("admin"),
    SUPER_ADMIN("super_admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public boolean isAdmin() {
        return this == ADMIN || this == SUPER_ADMIN;
    }

    // 문자열 값으로 Role 찾기
    public static Role fromValue(String value) {
        for (Role role : Role.values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role value: " + value);
    }
}
