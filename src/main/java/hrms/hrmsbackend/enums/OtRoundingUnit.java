package hrms.hrmsbackend.enums;

import lombok.Getter;

@Getter
public enum OtRoundingUnit {
    MINUTE(1),
    QUARTER_HOUR(15),
    HALF_HOUR(30),
    HOUR(60);

    private final int minutes;

    OtRoundingUnit(int minutes) {
        this.minutes = minutes;
    }
}
