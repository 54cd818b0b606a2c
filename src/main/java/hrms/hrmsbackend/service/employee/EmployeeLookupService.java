package hrms.hrmsbackend.service.employee;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class EmployeeLookupService {

    private final EmployeeRepository employeeRepository;

    /**
     * 직원 계정 전용 기능에서 principal 의 직원 행 조회
     */
    public Employee requireSelf(EssPrincipal principal) {
        if (principal.getEmployeeId() == null) {
            throw EssException.forbidden("This action requires an employee account");
        }
        return require(principal.getEmployeeId());
    }

    public Employee require(Long employeeId) {
        return employeeRepository.findById(employeeId)
                .orElseThrow(() -> EssException.notFound("Employee"));
    }

    public Map<Long, Employee> byIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        return employeeRepository.findByIdIn(ids).stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));
    }

    /**
     * 관리자 요청의 회사 범위 확인 (회사 컨텍스트 없는 super_admin 은 전체)
     */
    public void requireSameCompany(EssPrincipal principal, Employee employee) {
        if (principal.getCompanyId() == null && principal.isSuperAdmin()) {
            return;
        }
        if (!employee.getCompanyId().equals(principal.getCompanyId())) {
            throw EssException.forbidden("Employee does not belong to your company");
        }
    }
}
