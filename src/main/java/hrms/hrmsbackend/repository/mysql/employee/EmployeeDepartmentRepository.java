package hrms.hrmsbackend.repository.mysql.employee;

import hrms.hrmsbackend.entity.mysql.employee.EmployeeDepartment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmployeeDepartmentRepository extends JpaRepository<EmployeeDepartment, Long> {

    List<EmployeeDepartment> findByEmployeeId(Long employeeId);

    List<EmployeeDepartment> findByDepartmentId(Long departmentId);
}
