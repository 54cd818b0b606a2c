package hrms.hrmsbackend.dto.response.schedule;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class WeeklyValidationDto {
    private Long employeeId;
    private String employeeName;
    private int workDays;
    private int offDays;
    private int unscheduledDays;
    private int maxConsecutiveWork;
    private String warning;
}
