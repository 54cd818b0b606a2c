package hrms.hrmsbackend.service.permission;

import hrms.hrmsbackend.entity.mysql.employee.AdminUser;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.Role;
import lombok.Builder;
import lombok.Getter;

/**
 * 인증된 요청 주체. 직원 계정이면 id = employee.id, 관리자 계정이면 id = admin_user.id
 */
@Getter
@Builder(toBuilder = true)
public class EssPrincipal {

    private final Long id;
    private final String loginId; // 사번 또는 관리자 username
    private final String name;
    private final Long companyId; // super_admin 은 null
    private final Role role;
    private final EmployeeRole employeeRole;
    private final Long outletId;
    private final Long departmentId;
    private final Long positionId;
    private final String position;
    private final boolean scheduleManager;

    public static EssPrincipal of(Employee employee) {
        return EssPrincipal.builder()
                .id(employee.getId())
                .loginId(employee.getEmployeeCode())
                .name(employee.getName())
                .companyId(employee.getCompanyId())
                .role(Role.EMPLOYEE)
                .employeeRole(employee.getEmployeeRole() != null ? employee.getEmployeeRole() : EmployeeRole.STAFF)
                .outletId(employee.getOutletId())
                .departmentId(employee.getDepartmentId())
                .positionId(employee.getPositionId())
                .position(employee.getPosition())
                .scheduleManager(employee.isScheduleManager())
                .build();
    }

    public static EssPrincipal of(AdminUser admin) {
        return EssPrincipal.builder()
                .id(admin.getId())
                .loginId(admin.getUsername())
                .name(admin.getName())
                .companyId(admin.getCompanyId())
                .role(admin.getRole())
                .build();
    }

    public boolean isAdmin() {
        return role != null && role.isAdmin();
    }

    public boolean isSuperAdmin() {
        return role == Role.SUPER_ADMIN;
    }

    /**
     * 직원 계정일 때만 employee id, 관리자는 null
     */
    public Long getEmployeeId() {
        return isAdmin() ? null : id;
    }

    /**
     * super_admin 만 회사 컨텍스트를 바꿀 수 있다. 그 외에는 무시.
     */
    public EssPrincipal withCompanyContext(Long contextCompanyId) {
        if (!isSuperAdmin() || contextCompanyId == null) {
            return this;
        }
        return toBuilder().companyId(contextCompanyId).build();
    }
}
