package hrms.hrmsbackend.entity.mysql.employee;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 여러 매장을 담당하는 매니저의 매장 배정 (N:M)
 */
@Entity
@Table(name = "employee_outlet",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "outlet_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmployeeOutlet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "outlet_id", nullable = false)
    private Long outletId;
}
