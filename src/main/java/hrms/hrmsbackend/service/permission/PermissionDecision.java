package hrms.hrmsbackend.service.permission;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PermissionDecision {

    private static final PermissionDecision ALLOWED = new PermissionDecision(true, null, null);

    private final boolean allowed;
    private final DenialRule rule;
    private final String reason;

    public static PermissionDecision allow() {
        return ALLOWED;
    }

    public static PermissionDecision deny(DenialRule rule, String reason) {
        return new PermissionDecision(false, rule, reason);
    }

    public boolean isDenied() {
        return !allowed;
    }
}
