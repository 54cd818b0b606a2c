package hrms.hrmsbackend.dto.response.auth;

import hrms.hrmsbackend.service.permission.CapabilityBundle;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import lombok.Builder;
import lombok.Data;

/**
 * 세션 갱신 응답 (로그인 주체 + 권한 플래그)
 */
@Data
@Builder
public class PrincipalResponseDto {
    private Long id;
    private String loginId;
    private String name;
    private Long companyId;
    private String role;
    private Long outletId;
    private Long departmentId;
    private String position;
    private CapabilityBundle capabilities;

    public static PrincipalResponseDto of(EssPrincipal principal, CapabilityBundle capabilities) {
        return PrincipalResponseDto.builder()
                .id(principal.getId())
                .loginId(principal.getLoginId())
                .name(principal.getName())
                .companyId(principal.getCompanyId())
                .role(principal.getRole().getValue())
                .outletId(principal.getOutletId())
                .departmentId(principal.getDepartmentId())
                .position(principal.getPosition())
                .capabilities(capabilities)
                .build();
    }
}
