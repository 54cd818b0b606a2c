package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.response.notification.NotificationResponseDto;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.service.notification.NotificationService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 직원 계정 알림함 (최근 50건)
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<List<NotificationResponseDto>> list(@AuthenticationPrincipal EssPrincipal principal,
                                                              @RequestParam(defaultValue = "false") boolean unreadOnly) {
        return ResponseEntity.ok(notificationService.list(employeeId(principal), unreadOnly).stream()
                .map(NotificationResponseDto::fromEntity)
                .toList());
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(Map.of("count", notificationService.unreadCount(employeeId(principal))));
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<NotificationResponseDto> markRead(@AuthenticationPrincipal EssPrincipal principal,
                                                            @PathVariable Long id) {
        return ResponseEntity.ok(NotificationResponseDto.fromEntity(notificationService.markRead(employeeId(principal), id)));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Integer>> markAllRead(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(Map.of("updated", notificationService.markAllRead(employeeId(principal))));
    }

    private static Long employeeId(EssPrincipal principal) {
        if (principal.getEmployeeId() == null) {
            throw EssException.forbidden("This action requires an employee account");
        }
        return principal.getEmployeeId();
    }
}
