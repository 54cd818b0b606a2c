package hrms.hrmsbackend.dto.response.leave;

import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LeaveTypeResponseDto {
    private Long id;
    private String code;
    private String name;
    private Boolean paid;
    private Boolean requiresAttachment;
    private Boolean consecutive;
    private Integer maxOccurrences;
    private Integer minServiceDays;
    private Boolean eligible;
    private String eligibilityReason;

    public static LeaveTypeResponseDto of(LeaveType type, String ineligibleReason) {
        return LeaveTypeResponseDto.builder()
                .id(type.getId())
                .code(type.getCode())
                .name(type.getName())
                .paid(type.isPaidType())
                .requiresAttachment(type.isAttachmentRequired())
                .consecutive(type.isConsecutiveType())
                .maxOccurrences(type.getMaxOccurrences())
                .minServiceDays(type.getMinServiceDays())
                .eligible(ineligibleReason == null)
                .eligibilityReason(ineligibleReason)
                .build();
    }
}
