package hrms.hrmsbackend.service.permission;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.exception.EssException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * 승인 권한 판정: 기능 플래그 → 회사 → 관리 범위 → 계층 순으로 검사한다.
 * 계층은 승인자 레벨이 신청자 레벨보다 반드시 커야 한다 (같으면 거부).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionKernel {

    private final ScopeResolver scopeResolver;
    private final HierarchyLevelResolver hierarchyLevelResolver;

    public Scope scopeOf(EssPrincipal principal) {
        return scopeResolver.resolve(principal);
    }

    public CapabilityBundle capabilities(EssPrincipal principal) {
        return capabilities(principal, scopeResolver.resolve(principal));
    }

    public CapabilityBundle capabilities(EssPrincipal principal, Scope scope) {
        if (principal.isAdmin()) {
            return CapabilityBundle.forAdmin(scope.isOutletCompany(), new ArrayList<>(scope.getManagedOutlets()));
        }
        return CapabilityBundle.compute(principal.getEmployeeRole(), scope.isOutletCompany(),
                principal.isScheduleManager(), new ArrayList<>(scope.getManagedOutlets()));
    }

    public PermissionDecision checkApproval(EssPrincipal principal, Employee owner, Capability capability) {
        return checkApproval(principal, scopeResolver.resolve(principal), owner, capability);
    }

    /**
     * 같은 요청 안에서 여러 건을 판정할 때는 Scope 를 한 번만 계산해서 넘긴다
     */
    public PermissionDecision checkApproval(EssPrincipal principal, Scope scope, Employee owner, Capability capability) {
        PermissionDecision decision = evaluate(principal, scope, owner, capability);
        if (decision.isDenied()) {
            log.warn("권한 거부 [{}] principal={}({}), owner={}: {}", decision.getRule(),
                    principal.getLoginId(), principal.getRole(), owner.getId(), decision.getReason());
        }
        return decision;
    }

    public void requireApproval(EssPrincipal principal, Employee owner, Capability capability) {
        PermissionDecision decision = checkApproval(principal, owner, capability);
        if (decision.isDenied()) {
            throw EssException.forbidden(decision.getReason());
        }
    }

    public void requireCapability(EssPrincipal principal, Capability capability) {
        if (!principal.isAdmin() && !capabilities(principal).has(capability)) {
            log.warn("권한 거부 [{}] principal={}: {}", DenialRule.CAPABILITY, principal.getLoginId(), capability);
            throw EssException.forbidden("You do not have permission to manage " + capability.getSubject());
        }
    }

    /**
     * 회사/관리 범위만 확인 (계층 비교 없음). 스케줄 관리와 팀 조회에 쓰인다.
     */
    public PermissionDecision checkScope(Scope scope, Employee target) {
        if (!scope.sharesCompany(target.getCompanyId())) {
            return PermissionDecision.deny(DenialRule.COMPANY, "Employee does not belong to your company");
        }
        if (!scope.coversUnit(target.getOutletId(), target.getDepartmentId())) {
            return PermissionDecision.deny(DenialRule.SCOPE, scope.isOutletCompany()
                    ? "Employee is not in your managed outlets"
                    : "Employee is not in your managed departments");
        }
        return PermissionDecision.allow();
    }

    public void requireScope(EssPrincipal principal, Scope scope, Employee target) {
        PermissionDecision decision = checkScope(scope, target);
        if (decision.isDenied()) {
            log.warn("권한 거부 [{}] principal={}, target={}: {}", decision.getRule(),
                    principal.getLoginId(), target.getId(), decision.getReason());
            throw EssException.forbidden(decision.getReason());
        }
    }

    public int levelOf(EssPrincipal principal) {
        return hierarchyLevelResolver.levelOf(principal);
    }

    public int levelOf(Employee employee) {
        return hierarchyLevelResolver.levelOf(employee);
    }

    private PermissionDecision evaluate(EssPrincipal principal, Scope scope, Employee owner, Capability capability) {
        if (!principal.isAdmin() && owner.getId().equals(principal.getEmployeeId())) {
            return PermissionDecision.deny(DenialRule.SELF, "You cannot approve your own request");
        }
        if (!principal.isAdmin() && !capabilities(principal, scope).has(capability)) {
            return PermissionDecision.deny(DenialRule.CAPABILITY,
                    "You do not have permission to approve " + capability.getSubject());
        }
        PermissionDecision scoped = checkScope(scope, owner);
        if (scoped.isDenied()) {
            return scoped;
        }
        int principalLevel = principal.isAdmin() ? HierarchyLevelResolver.TOP : scope.getHierarchyLevel();
        int ownerLevel = hierarchyLevelResolver.levelOf(owner);
        if (principalLevel <= ownerLevel) {
            return PermissionDecision.deny(DenialRule.HIERARCHY, String.format(
                    "Hierarchy restriction: your level (%d) must be higher than the requester's level (%d)",
                    principalLevel, ownerLevel));
        }
        return PermissionDecision.allow();
    }
}
