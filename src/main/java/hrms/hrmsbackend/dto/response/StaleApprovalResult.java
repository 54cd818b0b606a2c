package hrms.hrmsbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class StaleApprovalResult {
    private int totalCount;      // 만료 대상 건수
    private int expiredCount;    // 실제 반려된 건수
    private int errorCount;
    private List<String> errors = new ArrayList<>();
}
