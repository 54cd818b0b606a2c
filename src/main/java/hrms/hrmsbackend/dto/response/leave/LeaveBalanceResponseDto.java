package hrms.hrmsbackend.dto.response.leave;

import hrms.hrmsbackend.entity.mysql.leave.LeaveBalance;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.service.leave.EntitlementCalculator;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LeaveBalanceResponseDto {
    private Long leaveTypeId;
    private String code;
    private String name;
    private Boolean paid;
    private Integer year;
    private Double entitled;
    private Double carriedForward;
    private Double used;
    private Double available;
    private Double ytdEarned;
    private Double advanceLeave;
    private Double earnedBalance; // 음수 가능

    public static LeaveBalanceResponseDto of(LeaveType type, LeaveBalance balance, EntitlementCalculator.Proration proration) {
        return LeaveBalanceResponseDto.builder()
                .leaveTypeId(type.getId())
                .code(type.getCode())
                .name(type.getName())
                .paid(type.isPaidType())
                .year(balance.getYear())
                .entitled(balance.getEntitledDays())
                .carriedForward(balance.getCarriedForward())
                .used(balance.getUsedDays())
                .available(balance.getAvailableDays())
                .ytdEarned(proration.getYtdEarned())
                .advanceLeave(proration.getAdvanceLeave())
                .earnedBalance(proration.getEarnedBalance())
                .build();
    }
}
