package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.config.EssPolicyProperties;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.ExtraShiftRequest;
import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestKind;
import hrms.hrmsbackend.enums.ScheduleStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ExtraShiftRequestRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ScheduleRepository;
import hrms.hrmsbackend.service.approval.RequestKindHandler;
import hrms.hrmsbackend.service.attendance.ClockInService;
import hrms.hrmsbackend.service.permission.Capability;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 추가 근무 요청 훅: 최종 승인 시 스케줄 생성
 */
@Component
@RequiredArgsConstructor
public class ExtraShiftRequestKind implements RequestKindHandler<ExtraShiftRequest> {

    private final ExtraShiftRequestRepository extraShiftRequestRepository;
    private final ScheduleRepository scheduleRepository;
    private final EmployeeRepository employeeRepository;
    private final ClockInService clockInService;
    private final EssPolicyProperties policy;

    @Override
    public RequestKind kind() {
        return RequestKind.EXTRA_SHIFT;
    }

    @Override
    public NotificationType notificationType() {
        return NotificationType.EXTRA_SHIFT;
    }

    @Override
    public Capability capability() {
        return Capability.MANAGE_SCHEDULE;
    }

    @Override
    public ExtraShiftRequest lockForTransition(Long id) {
        return extraShiftRequestRepository.findWithLockById(id)
                .orElseThrow(() -> EssException.notFound("Extra shift request"));
    }

    @Override
    public ExtraShiftRequest save(ExtraShiftRequest request) {
        return extraShiftRequestRepository.save(request);
    }

    @Override
    public String summarize(ExtraShiftRequest request) {
        return request.getRequestDate() + " " + request.getShiftStart() + "-" + request.getShiftEnd();
    }

    @Override
    public void onApproved(ExtraShiftRequest request) {
        if (scheduleRepository.existsByEmployeeIdAndScheduleDate(request.getEmployeeId(), request.getRequestDate())) {
            throw EssException.conflict("Schedule already exists for this employee on this date");
        }
        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> EssException.notFound("Employee"));
        Schedule schedule = scheduleRepository.save(Schedule.builder()
                .employeeId(employee.getId())
                .companyId(employee.getCompanyId())
                .outletId(employee.getOutletId())
                .departmentId(employee.getDepartmentId())
                .scheduleDate(request.getRequestDate())
                .shiftStart(request.getShiftStart())
                .shiftEnd(request.getShiftEnd())
                .breakDuration(policy.getDefaultBreakMinutes())
                .status(ScheduleStatus.SCHEDULED)
                .createdBy(request.getApprovedBy())
                .build());
        request.setScheduleId(schedule.getId());
        clockInService.syncSchedule(employee.getId(), schedule.getScheduleDate(), schedule);
    }

    @Override
    public void onReversed(ExtraShiftRequest request) {
        if (request.getScheduleId() != null) {
            scheduleRepository.findById(request.getScheduleId()).ifPresent(schedule -> {
                scheduleRepository.delete(schedule);
                clockInService.syncSchedule(schedule.getEmployeeId(), schedule.getScheduleDate(), null);
            });
            request.setScheduleId(null);
        }
    }
}
