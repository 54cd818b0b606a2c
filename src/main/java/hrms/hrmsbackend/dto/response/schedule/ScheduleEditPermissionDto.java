package hrms.hrmsbackend.dto.response.schedule;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class ScheduleEditPermissionDto {
    private boolean canEditAll;
    private LocalDate minEditDate;
    private String restrictionMessage;
}
