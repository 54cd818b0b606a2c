package hrms.hrmsbackend.service.leave;

import hrms.hrmsbackend.config.AutoApproveProperties;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.leave.LeaveRequestRepository;
import hrms.hrmsbackend.repository.mysql.leave.LeaveTypeRepository;
import hrms.hrmsbackend.service.approval.InitialApprovalPolicy;
import hrms.hrmsbackend.service.approval.InitialDecision;
import hrms.hrmsbackend.service.approval.RequestKindHandler;
import hrms.hrmsbackend.service.permission.Capability;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 휴가 요청 훅: 자동 승인 판정, 승인 시 차감, 되돌림 시 복원
 */
@Component
@RequiredArgsConstructor
public class LeaveRequestKind implements RequestKindHandler<LeaveRequest> {

    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final LeaveBalanceService leaveBalanceService;
    private final AutoApproveProperties autoApproveProperties;

    @Override
    public RequestKind kind() {
        return RequestKind.LEAVE;
    }

    @Override
    public NotificationType notificationType() {
        return NotificationType.LEAVE;
    }

    @Override
    public Capability capability() {
        return Capability.APPROVE_LEAVE;
    }

    @Override
    public LeaveRequest lockForTransition(Long id) {
        return leaveRequestRepository.findWithLockById(id)
                .orElseThrow(() -> EssException.notFound("Leave request"));
    }

    @Override
    public LeaveRequest save(LeaveRequest request) {
        return leaveRequestRepository.save(request);
    }

    @Override
    public String summarize(LeaveRequest request) {
        String typeName = leaveTypeRepository.findById(request.getLeaveTypeId())
                .map(LeaveType::getName)
                .orElse("Leave");
        return typeName + " " + request.getStartDate() + " to " + request.getEndDate()
                + ", " + LeaveBalanceService.formatDays(request.getTotalDays()) + " day(s)";
    }

    @Override
    public InitialDecision onCreate(LeaveRequest request, Employee owner, Company company) {
        LeaveType type = requireType(request);
        if (type.isPaidType() && autoApproveProperties.matches(company.getGroupingType(), type.getCode())) {
            return InitialDecision.autoApproved();
        }
        return InitialDecision.atLevel(InitialApprovalPolicy.initialLevel(company, owner));
    }

    @Override
    public void onApproved(LeaveRequest request) {
        if (request.isAutoApproved()) {
            request.setAutoApprovedAt(request.getApprovedAt());
        }
        if (requireType(request).isPaidType()) {
            leaveBalanceService.debit(request);
        }
    }

    @Override
    public void onReversed(LeaveRequest request) {
        if (requireType(request).isPaidType()) {
            leaveBalanceService.credit(request);
        }
    }

    private LeaveType requireType(LeaveRequest request) {
        return leaveTypeRepository.findById(request.getLeaveTypeId())
                .orElseThrow(() -> EssException.notFound("Leave type"));
    }
}
