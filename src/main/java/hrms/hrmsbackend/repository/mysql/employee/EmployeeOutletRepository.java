package hrms.hrmsbackend.repository.mysql.employee;

import hrms.hrmsbackend.entity.mysql.employee.EmployeeOutlet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmployeeOutletRepository extends JpaRepository<EmployeeOutlet, Long> {

    List<EmployeeOutlet> findByEmployeeId(Long employeeId);

    List<EmployeeOutlet> findByOutletId(Long outletId);
}
