package hrms.hrmsbackend.dto.response.attendance;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OtSummaryResponseDto {
    private int pendingCount;
    private String pendingHours;
    private int approvedThisMonth;
    private int rejectedThisMonth;
}
