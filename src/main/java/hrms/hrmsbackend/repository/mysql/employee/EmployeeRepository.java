package hrms.hrmsbackend.repository.mysql.employee;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.EmployeeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {

    Optional<Employee> findByEmployeeCode(String employeeCode);

    List<Employee> findByOutletIdAndStatus(Long outletId, EmployeeStatus status);

    List<Employee> findByDepartmentIdAndStatus(Long departmentId, EmployeeStatus status);

    List<Employee> findByIdIn(Collection<Long> ids);

    // 알림 대상 슈퍼바이저 조회
    Optional<Employee> findFirstByOutletIdAndEmployeeRoleAndStatus(Long outletId, EmployeeRole employeeRole, EmployeeStatus status);

    Optional<Employee> findFirstByDepartmentIdAndEmployeeRoleAndStatus(Long departmentId, EmployeeRole employeeRole, EmployeeStatus status);

    List<Employee> findByCompanyIdAndStatus(Long companyId, EmployeeStatus status);
}
