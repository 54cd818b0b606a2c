package hrms.hrmsbackend.service.attendance;

import hrms.hrmsbackend.entity.mysql.attendance.ClockInRecord;
import hrms.hrmsbackend.enums.AttendanceStatus;
import hrms.hrmsbackend.enums.PunchAction;
import hrms.hrmsbackend.exception.EssException;

import java.time.LocalDateTime;

/**
 * 하루 4회 출퇴근 순서 규칙 (in1 → out1 → in2 → out2).
 * 각 슬롯은 한 번만 기록되며 다음 동작은 첫 번째 빈 슬롯이다.
 */
public final class PunchProtocol {

    private PunchProtocol() {
    }

    /**
     * 다음 동작. 모두 기록됐으면 null
     */
    public static PunchAction nextAction(ClockInRecord record) {
        if (record == null || record.getClockIn1() == null) {
            return PunchAction.CLOCK_IN_1;
        }
        if (record.getClockOut2() != null) {
            return null;
        }
        if (record.getClockOut1() == null) {
            return PunchAction.CLOCK_OUT_1;
        }
        if (record.getClockIn2() == null) {
            return PunchAction.CLOCK_IN_2;
        }
        return PunchAction.CLOCK_OUT_2;
    }

    public static AttendanceStatus status(ClockInRecord record) {
        if (record == null || record.getClockIn1() == null) {
            return AttendanceStatus.NOT_STARTED;
        }
        if (record.getClockOut2() != null) {
            return AttendanceStatus.COMPLETED;
        }
        if (record.getClockOut1() != null && record.getClockIn2() == null) {
            return AttendanceStatus.ON_BREAK;
        }
        return AttendanceStatus.WORKING;
    }

    /**
     * 동작 가능 여부 검사. 위반 시 Validation 예외.
     * 휴게 없이 바로 퇴근(out2)하는 것은 허용된다.
     */
    public static void validate(ClockInRecord record, PunchAction action, String photo, Double latitude, Double longitude) {
        switch (action) {
            case CLOCK_IN_1 -> {
                if (photo == null || photo.isBlank()) {
                    throw EssException.validation("Photo is required for clock-in");
                }
                if (latitude == null || longitude == null) {
                    throw EssException.validation("GPS location is required for clock-in");
                }
                if (record != null && record.getClockIn1() != null) {
                    throw EssException.validation("You have already clocked in for today");
                }
            }
            case CLOCK_OUT_1 -> {
                requireClockedIn(record);
                if (record.getClockOut1() != null) {
                    throw EssException.validation("You have already taken your break");
                }
                requireNotClockedOut(record);
            }
            case CLOCK_IN_2 -> {
                if (record == null || record.getClockOut1() == null) {
                    throw EssException.validation("You must go on break first");
                }
                if (record.getClockIn2() != null) {
                    throw EssException.validation("You have already returned from break");
                }
                requireNotClockedOut(record);
            }
            case CLOCK_OUT_2 -> {
                requireClockedIn(record);
                requireNotClockedOut(record);
                if (record.getClockOut1() != null && record.getClockIn2() == null) {
                    // 휴게 중 퇴근 불가
                    throw EssException.validation("You must return from break first");
                }
            }
        }
    }

    /**
     * 슬롯 기록. 사진/위치는 해당 슬롯 칸에 저장한다.
     */
    public static void apply(ClockInRecord record, PunchAction action, LocalDateTime at, String photo, String location) {
        switch (action) {
            case CLOCK_IN_1 -> {
                record.setClockIn1(at);
                record.setPhotoIn1(photo);
                record.setLocationIn1(location);
            }
            case CLOCK_OUT_1 -> {
                record.setClockOut1(at);
                record.setPhotoOut1(photo);
                record.setLocationOut1(location);
            }
            case CLOCK_IN_2 -> {
                record.setClockIn2(at);
                record.setPhotoIn2(photo);
                record.setLocationIn2(location);
            }
            case CLOCK_OUT_2 -> {
                record.setClockOut2(at);
                record.setPhotoOut2(photo);
                record.setLocationOut2(location);
            }
        }
    }

    public static String formatLocation(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return null;
        }
        return latitude + "," + longitude;
    }

    private static void requireClockedIn(ClockInRecord record) {
        if (record == null || record.getClockIn1() == null) {
            throw EssException.validation("You must clock in first");
        }
    }

    private static void requireNotClockedOut(ClockInRecord record) {
        if (record.getClockOut2() != null) {
            throw EssException.validation("You have already clocked out for the day");
        }
    }
}
