package hrms.hrmsbackend.dto.request.profile;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 본인이 수정할 수 있는 연락처 항목만 포함 (null 이면 변경 없음)
 */
@Getter
@Setter
@NoArgsConstructor
public class ProfileUpdateRequestDto {

    @Size(max = 30)
    private String phone;

    @Email
    @Size(max = 100)
    private String email;

    @Size(max = 500)
    private String address;

    @Size(max = 100)
    private String emergencyContactName;

    @Size(max = 30)
    private String emergencyContactPhone;
}
