package hrms.hrmsbackend.dto.response.attendance;

import hrms.hrmsbackend.enums.AttendanceStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class ClockStatusResponseDto {
    private LocalDate workDate;
    private AttendanceStatus status;
    private String nextAction; // null = 완료
    private boolean clockInRequired;
    private ClockInRecordResponseDto record;
}
