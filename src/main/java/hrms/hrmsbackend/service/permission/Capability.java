package hrms.hrmsbackend.service.permission;

import lombok.Getter;

@Getter
public enum Capability {
    APPROVE_LEAVE("leave requests"),
    APPROVE_OT("overtime"),
    APPROVE_SWAPS("shift swaps"),
    APPROVE_CLAIMS("claims"),
    VIEW_TEAM("team data"),
    MANAGE_SCHEDULE("schedules");

    private final String subject;

    Capability(String subject) {
        this.subject = subject;
    }
}
