package hrms.hrmsbackend.template;

import lombok.Getter;

/**
 * 앱 내 알림 제목/본문 템플릿. #{변수} 는 NotificationService 에서 치환된다.
 */
@Getter
public enum NotificationTemplate {
    REQUEST_SUBMITTED("REQUEST_SUBMITTED",
            "#{kind} Approval Required",
            "#{requesterName} submitted a #{kindLower} request (#{summary}) that is awaiting your approval."
    ),

    REQUEST_ADVANCED("REQUEST_ADVANCED",
            "#{kind} Progressed",
            "Your #{kindLower} request (#{summary}) was approved by #{approverName} and is now awaiting level #{level} approval."
    ),

    REQUEST_APPROVED("REQUEST_APPROVED",
            "#{kind} Approved",
            "Your #{kindLower} request (#{summary}) has been approved."
    ),

    REQUEST_AUTO_APPROVED("REQUEST_AUTO_APPROVED",
            "#{kind} Auto-Approved",
            "Your #{kindLower} request (#{summary}) has been auto-approved."
    ),

    REQUEST_REJECTED("REQUEST_REJECTED",
            "#{kind} Rejected",
            "Your #{kindLower} request (#{summary}) has been rejected. Reason: #{reason}"
    ),

    REQUEST_CANCELLED("REQUEST_CANCELLED",
            "#{kind} Cancelled",
            "Your #{kindLower} request (#{summary}) has been cancelled."
    ),

    REQUEST_REVERTED("REQUEST_REVERTED",
            "#{kind} Reverted",
            "Your #{kindLower} request (#{summary}) has been reverted and is awaiting admin approval."
    ),

    OT_APPROVED("OT_APPROVED",
            "OT Approved",
            "Your #{hours} hours of overtime on #{date} has been approved."
    ),

    OT_REJECTED("OT_REJECTED",
            "OT Rejected",
            "Your #{hours} hours of overtime on #{date} has been rejected. Reason: #{reason}"
    ),

    SWAP_REQUESTED("SWAP_REQUESTED",
            "Shift Swap Request",
            "#{requesterName} wants to swap their shift on #{requesterDate} with your shift on #{targetDate}."
    ),

    SWAP_ACCEPTED("SWAP_ACCEPTED",
            "Shift Swap Accepted",
            "#{targetName} accepted your shift swap request. It is now awaiting supervisor approval."
    ),

    SWAP_APPROVAL_REQUIRED("SWAP_APPROVAL_REQUIRED",
            "Shift Swap Approval Required",
            "#{requesterName} and #{targetName} want to swap shifts (#{requesterDate} and #{targetDate})."
    ),

    SWAP_DECLINED("SWAP_DECLINED",
            "Shift Swap Declined",
            "#{targetName} declined your shift swap request."
    ),

    SWAP_APPROVED("SWAP_APPROVED",
            "Shift Swap Approved",
            "The shift swap between #{requesterDate} and #{targetDate} has been approved."
    ),

    SWAP_REJECTED("SWAP_REJECTED",
            "Shift Swap Rejected",
            "The shift swap between #{requesterDate} and #{targetDate} has been rejected. Reason: #{reason}"
    ),

    LETTER_ISSUED("LETTER_ISSUED",
            "New Letter",
            "You have received a new letter: #{subject}"
    );

    private final String code;
    private final String title;
    private final String template;

    NotificationTemplate(String code, String title, String template) {
        this.code = code;
        this.title = title;
        this.template = template;
    }

    public static NotificationTemplate findByCode(String code) {
        for (NotificationTemplate t : values()) {
            if (t.code.equalsIgnoreCase(code)) return t;
        }
        return null;
    }
}
