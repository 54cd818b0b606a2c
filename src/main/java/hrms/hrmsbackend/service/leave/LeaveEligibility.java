package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 휴가 종류별 신청 자격. 사유가 있으면 신청 불가.
 */
public final class LeaveEligibility {

    private LeaveEligibility() {
    }

    public static Optional<String> genderReason(LeaveType type, Employee employee) {
        if (type.getGenderRestriction() != null && type.getGenderRestriction() != employee.getGender()) {
            return Optional.of("This leave type is only available for "
                    + type.getGenderRestriction().displayName() + " employees");
        }
        return Optional.empty();
    }

    public static Optional<String> serviceReason(LeaveType type, Employee employee, LocalDate today) {
        Integer minDays = type.getMinServiceDays();
        if (minDays != null && minDays > 0 && EntitlementCalculator.serviceDays(employee.getJoinDate(), today) < minDays) {
            return Optional.of("Minimum " + minDays + " days of service required");
        }
        return Optional.empty();
    }

    public static Optional<String> occurrenceReason(LeaveType type, long usedThisYear) {
        Integer max = type.getMaxOccurrences();
        if (max != null && usedThisYear >= max) {
            return Optional.of("Maximum " + max + " occurrences already used");
        }
        return Optional.empty();
    }

    public static Optional<String> attachmentReason(LeaveType type, String attachmentUrl) {
        if (type.isAttachmentRequired() && (attachmentUrl == null || attachmentUrl.isBlank())) {
            return Optional.of("Attachment is required for this leave type");
        }
        return Optional.empty();
    }

    /**
     * 신청 전 검사 (성별 → 근속 → 횟수 → 첨부)
     */
    public static Optional<String> check(LeaveType type, Employee employee, LocalDate today,
                                         long usedThisYear, String attachmentUrl) {
        return genderReason(type, employee)
                .or(() -> serviceReason(type, employee, today))
                .or(() -> occurrenceReason(type, usedThisYear))
                .or(() -> attachmentReason(type, attachmentUrl));
    }
}
