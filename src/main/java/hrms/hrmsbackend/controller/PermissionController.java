package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.service.permission.CapabilityBundle;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.PermissionKernel;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.security.core.annotation.AuthenticationPrincipal;

@RestController
@RequestMapping("/api/v1/permissions")
@RequiredArgsConstructor
public class PermissionController {

    private final PermissionKernel permissionKernel;

    /**
     * 현재 주체의 권한 플래그 (화면 메뉴 노출용)
     */
    @GetMapping("/me")
    public ResponseEntity<CapabilityBundle> myCapabilities(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(permissionKernel.capabilities(principal));
    }
}
