package hrms.hrmsbackend.enums;

/**
 * 회사의 조직 단위. OUTLET = 매장/교대 근무 기반, DEPARTMENT = 부서/사무실 기반.
 */
public enum GroupingType {
    OUTLET,
    DEPARTMENT
}
