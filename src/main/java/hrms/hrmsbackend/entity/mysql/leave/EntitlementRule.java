package hrms.hrmsbackend.entity.mysql.leave;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 근속연수 구간별 부여 일수
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EntitlementRule {

    @Column(name = "min_service_years", nullable = false)
    private Double minServiceYears;

    @Column(name = "days", nullable = false)
    private Double days;
}
