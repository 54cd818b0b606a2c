package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.dto.response.schedule.ScheduleEditPermissionDto;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * 스케줄 편집 가능 일자 규칙 (T+2).
 * director/boss/admin 은 과거가 아닌 날짜라면 제한 없이 편집할 수 있다.
 */
@Component
@RequiredArgsConstructor
public class ScheduleEditPolicy {

    private final EssPolicyProperties policy;
    private final Clock clock;

    public boolean canEditAll(EssPrincipal principal) {
        return principal.isAdmin()
                || (principal.getEmployeeRole() != null && principal.getEmployeeRole().isBossOrDirector());
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate minEditDate(EssPrincipal principal) {
        return canEditAll(principal) ? today() : today().plusDays(policy.getScheduleLeadDays());
    }

    public String restrictionMessage() {
        int lead = policy.getScheduleLeadDays();
        return "Cannot create/edit schedules within " + lead + " days (T+" + lead + " rule)";
    }

    /**
     * 위반 사유. 편집 가능하면 empty
     */
    public Optional<String> violation(EssPrincipal principal, LocalDate scheduleDate) {
        if (scheduleDate == null) {
            return Optional.of("Schedule date is required");
        }
        if (scheduleDate.isBefore(today())) {
            return Optional.of("Cannot create schedules for past dates");
        }
        if (!canEditAll(principal) && scheduleDate.isBefore(minEditDate(principal))) {
            return Optional.of(restrictionMessage());
        }
        return Optional.empty();
    }

    public void check(EssPrincipal principal, LocalDate scheduleDate) {
        violation(principal, scheduleDate).ifPresent(reason -> {
            throw EssException.validation(reason);
        });
    }

    public ScheduleEditPermissionDto view(EssPrincipal principal) {
        boolean all = canEditAll(principal);
        return ScheduleEditPermissionDto.builder()
                .canEditAll(all)
                .minEditDate(minEditDate(principal))
                .restrictionMessage(all ? null : restrictionMessage())
                .build();
    }
}
