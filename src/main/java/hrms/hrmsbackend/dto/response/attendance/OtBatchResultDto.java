package hrms.hrmsbackend.dto.response.attendance;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class OtBatchResultDto {

    private String action;
    private int processed;
    private int approved;
    private int rejected;
    private List<Skipped> skipped = new ArrayList<>();

    public OtBatchResultDto(String action) {
        this.action = action;
    }

    public void skip(Long id, String reason) {
        skipped.add(new Skipped(id, reason));
    }

    @Getter
    @AllArgsConstructor
    public static class Skipped {
        private Long id;
        private String reason;
    }
}
