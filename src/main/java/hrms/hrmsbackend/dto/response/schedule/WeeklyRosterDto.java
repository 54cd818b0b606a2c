package hrms.hrmsbackend.dto.response.schedule;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class WeeklyRosterDto {
    private LocalDate weekStart;
    private LocalDate weekEnd;
    private Long outletId;
    private Long departmentId;
    private List<LocalDate> days;
    private List<Row> rows;

    @Data
    @Builder
    public static class Row {
        private Long employeeId;
        private String employeeName;
        private String employeeCode;
        private Map<LocalDate, ScheduleResponseDto> shifts; // 날짜 → 배정
    }
}
