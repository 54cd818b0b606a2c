package hrms.hrmsbackend.enums;

import java.time.DayOfWeek;
import java.time.LocalDate;

public enum WorkingWeek {
    SEVEN_DAY,   // 월~일 근무 (매장)
    FIVE_DAY;    // 월~금 근무 (사무실)

    public boolean isWorkingDay(LocalDate date) {
        if (this == SEVEN_DAY) {
            return true;
        }
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    public static WorkingWeek defaultFor(GroupingType groupingType) {
        return groupingType == GroupingType.OUTLET ? SEVEN_DAY : FIVE_DAY;
    }
}
