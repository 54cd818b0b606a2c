package hrms.hrmsbackend.dto.response.schedule;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.entity.mysql.schedule.ShiftSwapRequest;
import hrms.hrmsbackend.enums.SwapStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
public class ShiftSwapResponseDto {
    private Long id;
    private Long outletId;
    private Long requesterId;
    private String requesterName;
    private Long requesterShiftId;
    private LocalDate requesterDate;
    private Long targetId;
    private String targetName;
    private Long targetShiftId;
    private LocalDate targetDate;
    private String reason;
    private SwapStatus status;
    private LocalDateTime targetRespondedAt;
    private Long supervisorId;
    private LocalDateTime supervisorDecidedAt;
    private String rejectionReason;
    private LocalDateTime createdAt;

    public static ShiftSwapResponseDto fromEntity(ShiftSwapRequest swap, Employee requester, Employee target,
                                                  Schedule requesterShift, Schedule targetShift) {
        return ShiftSwapResponseDto.builder()
                .id(swap.getId())
                .outletId(swap.getOutletId())
                .requesterId(swap.getRequesterId())
                .requesterName(requester != null ? requester.getName() : null)
                .requesterShiftId(swap.getRequesterShiftId())
                .requesterDate(requesterShift != null ? requesterShift.getScheduleDate() : null)
                .targetId(swap.getTargetId())
                .targetName(target != null ? target.getName() : null)
                .targetShiftId(swap.getTargetShiftId())
                .targetDate(targetShift != null ? targetShift.getScheduleDate() : null)
                .reason(swap.getReason())
                .status(swap.getStatus())
                .targetRespondedAt(swap.getTargetRespondedAt())
                .supervisorId(swap.getSupervisorId())
                .supervisorDecidedAt(swap.getSupervisorDecidedAt())
                .rejectionReason(swap.getRejectionReason())
                .createdAt(swap.getCreatedAt())
                .build();
    }
}
