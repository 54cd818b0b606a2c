package hrms.hrmsbackend.enums;

import lombok.Getter;

/**
 * 4회 출퇴근 기록 순서: 출근 → 휴게 시작 → 휴게 종료 → 퇴근
 */
@Getter
public enum PunchAction {
    CLOCK_IN_1("clock_in_1"),
    CLOCK_OUT_1("clock_out_1"),
    CLOCK_IN_2("clock_in_2"),
    CLOCK_OUT_2("clock_out_2");

    private final String value;

    PunchAction(String value) {
        this.value = value;
    }

    public static PunchAction fromValue(String value) {
        for (PunchAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown clock action: " + value);
    }
}
