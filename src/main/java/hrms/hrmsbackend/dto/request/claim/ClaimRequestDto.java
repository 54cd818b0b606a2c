package hrms.hrmsbackend.dto.request.claim;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
public class ClaimRequestDto {
    private LocalDate claimDate;

    @Size(max = 50)
    private String category;

    @Size(max = 2000)
    private String description;

    private BigDecimal amount;

    @Size(max = 255)
    private String receiptUrl;
}
