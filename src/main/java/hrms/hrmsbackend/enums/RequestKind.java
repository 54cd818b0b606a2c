package hrms.hrmsbackend.enums;

import lombok.Getter;

/**
 * 승인 흐름을 공유하는 요청 종류. referenceType 은 알림의 reference_type 값으로 쓰인다.
 */
@Getter
public enum RequestKind {
    LEAVE("leave", "Leave"),
    OVERTIME("overtime", "Overtime"),
    CLAIM("claim", "Claim"),
    EXTRA_SHIFT("extra_shift", "Extra Shift"),
    SHIFT_SWAP("shift_swap", "Shift Swap");

    private final String referenceType;
    private final String displayName;

    RequestKind(String referenceType, String displayName) {
        this.referenceType = referenceType;
        this.displayName = displayName;
    }
}
