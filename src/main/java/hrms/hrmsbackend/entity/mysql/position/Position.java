package hrms.hrmsbackend.entity.mysql.position;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 회사별 직책. role 은 자유 문자열이며 계층 테이블로 레벨이 정해진다.
 */
@Entity
@Table(name = "position",
        indexes = {
                @Index(name = "idx_position_company", columnList = "company_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id")
    private Long companyId;

    @Column(name = "name", nullable = false, length = 50)
    private String name; // 직책명 (예: "Outlet Supervisor", "Barista")

    @Column(name = "role", length = 50)
    private String role; // 계층 판정용 역할 문자열

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Position(Long companyId, String name, String role) {
        this.companyId = companyId;
        this.name = name;
        this.role = role;
    }
}
