package hrms.hrmsbackend.dto.request.attendance;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * OT 일괄 승인/반려. 입력 검사는 서비스에서 메시지와 함께 수행한다.
 */
@Getter
@Setter
@NoArgsConstructor
public class OtBatchRequestDto {
    private List<Long> recordIds;
    private String action; // approve | reject
    private String reason;
}
