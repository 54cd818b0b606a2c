package hrms.hrmsbackend.dto.response.leave;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class EncashmentResponseDto {
    private Long employeeId;
    private Integer year;
    private Double remainingDays;
    private BigDecimal basicSalary;
    private BigDecimal rate;
    private BigDecimal amount;
}
