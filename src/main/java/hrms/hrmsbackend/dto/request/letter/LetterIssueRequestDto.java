package hrms.hrmsbackend.dto.request.letter;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class LetterIssueRequestDto {

    @NotNull
    private Long employeeId;

    @Size(max = 50)
    private String letterType;

    @NotBlank
    @Size(max = 255)
    private String subject;

    private String content;
}
