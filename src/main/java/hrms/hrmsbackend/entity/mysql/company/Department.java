package hrms.hrmsbackend.entity.mysql.company;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "department", indexes = @Index(name = "idx_department_company", columnList = "company_id"))
public class Department {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "name", length = 50)
    private String name; // 부서 이름

    @Column(name = "is_active")
    @Builder.Default
    private Boolean active = true;
}
