package hrms.hrmsbackend.service.permission;

import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.company.Department;
import hrms.hrmsbackend.entity.mysql.company.Outlet;
import hrms.hrmsbackend.entity.mysql.employee.EmployeeDepartment;
import hrms.hrmsbackend.entity.mysql.employee.EmployeeOutlet;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.company.CompanyRepository;
import hrms.hrmsbackend.repository.mysql.company.DepartmentRepository;
import hrms.hrmsbackend.repository.mysql.company.OutletRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeDepartmentRepository;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeOutletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * principal → Scope 계산. 조회만 하며 상태를 바꾸지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScopeResolver {

    private final CompanyRepository companyRepository;
    private final OutletRepository outletRepository;
    private final DepartmentRepository departmentRepository;
    private final EmployeeOutletRepository employeeOutletRepository;
    private final EmployeeDepartmentRepository employeeDepartmentRepository;
    private final HierarchyLevelResolver hierarchyLevelResolver;

    public Scope resolve(EssPrincipal principal) {
        Company company = principal.getCompanyId() != null ? requireCompany(principal.getCompanyId()) : null;

        if (principal.isAdmin()) {
            if (company == null && !principal.isSuperAdmin()) {
                throw EssException.forbidden("Admin account is not assigned to a company");
            }
            return Scope.builder()
                    .company(company)
                    .grouping(company != null ? company.getGroupingType() : null)
                    .companyWide(true)
                    .managedOutlets(company != null && company.isOutletBased() ? allOutlets(company.getId()) : Collections.emptySet())
                    .managedDepartments(company != null && !company.isOutletBased() ? allDepartments(company.getId()) : Collections.emptySet())
                    .hierarchyLevel(HierarchyLevelResolver.TOP)
                    .build();
        }

        if (company == null) {
            throw EssException.unauthenticated("Employee is not assigned to a company");
        }

        EmployeeRole role = principal.getEmployeeRole() != null ? principal.getEmployeeRole() : EmployeeRole.STAFF;
        Scope.ScopeBuilder builder = Scope.builder()
                .company(company)
                .grouping(company.getGroupingType())
                .hierarchyLevel(hierarchyLevelResolver.levelOf(principal));

        if (role.isBossOrDirector()) {
            return builder.companyWide(true)
                    .managedOutlets(company.isOutletBased() ? allOutlets(company.getId()) : Collections.emptySet())
                    .managedDepartments(company.isOutletBased() ? Collections.emptySet() : allDepartments(company.getId()))
                    .build();
        }

        if (company.isOutletBased()) {
            builder.managedOutlets(managedOutlets(principal, role));
        } else {
            builder.managedDepartments(managedDepartments(principal, role));
        }
        return builder.companyWide(false).build();
    }

    private Set<Long> managedOutlets(EssPrincipal principal, EmployeeRole role) {
        Set<Long> outlets = new LinkedHashSet<>();
        switch (role) {
            case SUPERVISOR -> {
                if (principal.getOutletId() != null) {
                    outlets.add(principal.getOutletId());
                } else {
                    outlets.addAll(assignedOutlets(principal.getId()));
                }
            }
            case MANAGER -> {
                outlets.addAll(assignedOutlets(principal.getId()));
                if (principal.getOutletId() != null) {
                    outlets.add(principal.getOutletId());
                }
            }
            default -> {
                // staff: 관리 범위 없음
            }
        }
        return outlets;
    }

    private Set<Long> managedDepartments(EssPrincipal principal, EmployeeRole role) {
        Set<Long> departments = new LinkedHashSet<>();
        if (role == EmployeeRole.SUPERVISOR) {
            if (principal.getDepartmentId() != null) {
                departments.add(principal.getDepartmentId());
            } else {
                departments.addAll(assignedDepartments(principal.getId()));
            }
        } else if (role == EmployeeRole.MANAGER || principal.isScheduleManager()) {
            // 사무실 회사의 지정 스케줄 관리자도 소속 부서를 관리
            departments.addAll(assignedDepartments(principal.getId()));
            if (principal.getDepartmentId() != null) {
                departments.add(principal.getDepartmentId());
            }
        }
        return departments;
    }

    private Set<Long> assignedOutlets(Long employeeId) {
        return employeeOutletRepository.findByEmployeeId(employeeId).stream()
                .map(EmployeeOutlet::getOutletId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private Set<Long> assignedDepartments(Long employeeId) {
        return employeeDepartmentRepository.findByEmployeeId(employeeId).stream()
                .map(EmployeeDepartment::getDepartmentId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private Set<Long> allOutlets(Long companyId) {
        return outletRepository.findByCompanyId(companyId).stream()
                .map(Outlet::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private Set<Long> allDepartments(Long companyId) {
        return departmentRepository.findByCompanyId(companyId).stream()
                .map(Department::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Company requireCompany(Long companyId) {
        return companyRepository.findCachedById(companyId)
                .orElseThrow(() -> EssException.notFound("Company"));
    }
}
