package hrms.hrmsbackend.dto.response.attendance;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AttendanceHistoryResponseDto {
    private List<ClockInRecordResponseDto> records;
    private int totalDays;
    private String totalHours;
    private String totalOtHours;
    private int pendingCompletion; // 퇴근 기록이 없는 날
}
