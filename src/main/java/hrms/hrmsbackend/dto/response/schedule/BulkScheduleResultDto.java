package hrms.hrmsbackend.dto.response.schedule;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 일괄 생성/배정 결과. 행 단위 실패는 errors 에 모은다.
 */
@Getter
@Setter
public class BulkScheduleResultDto {

    private int created;
    private int skipped;
    private List<RowError> errors = new ArrayList<>();

    public void addError(Long employeeId, LocalDate date, String error) {
        errors.add(new RowError(employeeId, date, error));
    }

    @Getter
    @AllArgsConstructor
    public static class RowError {
        private Long employeeId;
        private LocalDate date;
        private String error;
    }
}
