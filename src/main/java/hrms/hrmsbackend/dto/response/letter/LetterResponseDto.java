package hrms.hrmsbackend.dto.response.letter;

import hrms.hrmsbackend.entity.mysql.Letter;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class LetterResponseDto {
    private Long id;
    private Long employeeId;
    private String letterType;
    private String subject;
    private String content;
    private Boolean read;
    private LocalDateTime readAt;
    private LocalDateTime createdAt;

    public static LetterResponseDto fromEntity(Letter letter) {
        return LetterResponseDto.builder()
                .id(letter.getId())
                .employeeId(letter.getEmployeeId())
                .letterType(letter.getLetterType())
                .subject(letter.getSubject())
                .content(letter.getContent())
                .read(letter.getRead())
                .readAt(letter.getReadAt())
                .createdAt(letter.getCreatedAt())
                .build();
    }
}
