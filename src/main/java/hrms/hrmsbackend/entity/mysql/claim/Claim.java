package hrms.hrmsbackend.entity.mysql.claim;

import hrms.hrmsbackend.entity.mysql.approval.ApprovableRequest;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "claim", indexes = @Index(name = "idx_claim_employee", columnList = "employee_id, status"))
@Getter
@Setter
@NoArgsConstructor
public class Claim extends ApprovableRequest {

    @Column(name = "claim_date", nullable = false, updatable = false)
    private LocalDate claimDate;

    @Column(name = "category", nullable = false, length = 50, updatable = false)
    private String category;

    @Column(name = "description", columnDefinition = "TEXT", updatable = false)
    private String description;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(name = "receipt_url", updatable = false)
    private String receiptUrl;
}
