package hrms.hrmsbackend.dto.response.schedule;

import hrms.hrmsbackend.entity.mysql.schedule.ShiftTemplate;
import lombok.Builder;
import lombok.Data;

import java.time.LocalTime;

@Data
@Builder
public class ShiftTemplateResponseDto {
    private Long id;
    private String code;
    private String name;
    private LocalTime startTime;
    private LocalTime endTime;
    private Integer breakDuration;
    private String color;
    private boolean off;

    public static ShiftTemplateResponseDto fromEntity(ShiftTemplate template) {
        return ShiftTemplateResponseDto.builder()
                .id(template.getId())
                .code(template.getCode())
                .name(template.getName())
                .startTime(template.getStartTime())
                .endTime(template.getEndTime())
                .breakDuration(template.getBreakDuration())
                .color(template.getColor())
                .off(template.isOffTemplate())
                .build();
    }
}
