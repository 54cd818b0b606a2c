package hrms.hrmsbackend.service.permission;

/**
 * 권한 거부 사유 구분 (로그용). 사용자에게는 reason 문자열만 노출된다.
 */
public enum DenialRule {
    SELF,
    CAPABILITY,
    COMPANY,
    SCOPE,
    HIERARCHY
}
