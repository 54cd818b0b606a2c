package hrms.hrmsbackend.service.notification;

import hrms.hrmsbackend.entity.mysql.Notification;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.NotificationRepository;
import hrms.hrmsbackend.template.NotificationTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 앱 내 알림. 상태 전이와 같은 트랜잭션에서 알림 행을 기록한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public Notification send(Long employeeId, NotificationType type, NotificationTemplate template,
                             Map<String, String> variables, String referenceType, Long referenceId) {
        if (employeeId == null) {
            log.debug("수신자가 없어 알림을 건너뜁니다: {}", template.getCode());
            return null;
        }
        Notification notification = Notification.builder()
                .employeeId(employeeId)
                .type(type)
                .title(replaceTemplateVariables(template.getTitle(), variables))
                .message(replaceTemplateVariables(template.getTemplate(), variables))
                .referenceType(referenceType)
                .referenceId(referenceId)
                .createdAt(LocalDateTime.now(clock))
                .build();
        Notification saved = notificationRepository.save(notification);
        log.debug("알림 기록 - employeeId: {}, template: {}, ref: {}#{}", employeeId, template.getCode(), referenceType, referenceId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Notification> list(Long employeeId, boolean unreadOnly) {
        return unreadOnly
                ? notificationRepository.findTop50ByEmployeeIdAndReadFalseOrderByCreatedAtDesc(employeeId)
                : notificationRepository.findTop50ByEmployeeIdOrderByCreatedAtDesc(employeeId);
    }

    @Transactional
    public Notification markRead(Long employeeId, Long notificationId) {
        Notification notification = notificationRepository.findByIdAndEmployeeId(notificationId, employeeId)
                .orElseThrow(() -> EssException.notFound("Notification"));
        notification.setRead(true);
        return notificationRepository.save(notification);
    }

    @Transactional
    public int markAllRead(Long employeeId) {
        return notificationRepository.markAllRead(employeeId);
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long employeeId) {
        return notificationRepository.countByEmployeeIdAndReadFalse(employeeId);
    }

    /**
     * 템플릿 변수 치환
     */
    static String replaceTemplateVariables(String template, Map<String, String> variables) {
        if (template == null) return "";
        if (variables == null || variables.isEmpty()) return template;

        String result = template;
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            String placeholder = "#{" + entry.getKey() + "}";
            String value = entry.getValue() != null ? entry.getValue() : "";
            result = result.replace(placeholder, value);
        }

        if (result.contains("#{")) {
            log.warn("치환되지 않은 템플릿 변수가 있습니다: {}", result);
        }
        return result;
    }
}
