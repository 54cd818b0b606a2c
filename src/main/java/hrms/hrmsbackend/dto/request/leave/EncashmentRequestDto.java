package hrms.hrmsbackend.dto.request.leave;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
public class EncashmentRequestDto {

    @NotNull(message = "Employee is required")
    private Long employeeId;

    private Integer year;

    @DecimalMin(value = "0.0", message = "Rate cannot be negative")
    private BigDecimal rate = BigDecimal.ONE;
}
