package hrms.hrmsbackend.service.approval;

import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.EmployeeRole;

/**
 * 시작 승인 단계.
 * 사무실 회사: 관리자 단계(3)부터, 매장 회사 슈퍼바이저 본인 요청: 2, 그 외: 1
 */
public final class InitialApprovalPolicy {

    private InitialApprovalPolicy() {
    }

    public static int initialLevel(Company company, Employee owner) {
        if (!company.isOutletBased()) {
            return ApprovalStateMachine.LEVEL_ADMIN;
        }
        if (owner.getEmployeeRole() == EmployeeRole.SUPERVISOR) {
            return ApprovalStateMachine.LEVEL_MANAGER;
        }
        return ApprovalStateMachine.LEVEL_SUPERVISOR;
    }
}
