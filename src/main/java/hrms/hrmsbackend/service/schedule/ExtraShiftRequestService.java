package hrms.hrmsbackend.service.schedule;

import hrms.hrmsbackend.dto.request.schedule.ExtraShiftRequestDto;
import hrms.hrmsbackend.dto.response.schedule.ExtraShiftResponseDto;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.schedule.ExtraShiftRequest;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.schedule.ExtraShiftRequestRepository;
import hrms.hrmsbackend.repository.mysql.schedule.ScheduleRepository;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.ScopeResolver;
import hrms.hrmsbackend.util.TransactionRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ExtraShiftRequestService {

    private final ExtraShiftRequestRepository extraShiftRequestRepository;
    private final ScheduleRepository scheduleRepository;
    private final ExtraShiftRequestKind extraShiftRequestKind;
    private final RequestLifecycleService lifecycle;
    private final EmployeeLookupService employeeLookupService;
    private final ScopeResolver scopeResolver;
    private final TransactionRunner transactionRunner;
    private final Clock clock;

    public ExtraShiftResponseDto submit(EssPrincipal principal, ExtraShiftRequestDto dto) {
        if (dto.getRequestDate() == null || dto.getShiftStart() == null || dto.getShiftEnd() == null) {
            throw EssException.validation("Date, shift start and end times are required");
        }
        return transactionRunner.inSerializable("submit extra shift", () -> {
            Employee employee = employeeLookupService.requireSelf(principal);
            if (dto.getRequestDate().isBefore(LocalDate.now(clock))) {
                throw EssException.validation("Cannot request extra shift for past dates");
            }
            if (scheduleRepository.existsByEmployeeIdAndScheduleDate(employee.getId(), dto.getRequestDate())) {
                throw EssException.validation("You already have a schedule for this date");
            }
            if (extraShiftRequestRepository.existsByEmployeeIdAndRequestDateAndStatus(employee.getId(),
                    dto.getRequestDate(), RequestStatus.PENDING)) {
                throw EssException.validation("You already have a pending request for this date");
            }
            Company company = scopeResolver.requireCompany(employee.getCompanyId());

            ExtraShiftRequest request = new ExtraShiftRequest();
            request.setRequestDate(dto.getRequestDate());
            request.setShiftStart(dto.getShiftStart());
            request.setShiftEnd(dto.getShiftEnd());
            request.setReason(dto.getReason());
            return ExtraShiftResponseDto.fromEntity(lifecycle.open(extraShiftRequestKind, request, employee, company), employee);
        });
    }

    @Transactional(readOnly = true)
    public List<ExtraShiftResponseDto> myRequests(EssPrincipal principal) {
        Employee employee = employeeLookupService.requireSelf(principal);
        return extraShiftRequestRepository.findByEmployeeIdOrderByCreatedAtDesc(employee.getId()).stream()
                .map(r -> ExtraShiftResponseDto.fromEntity(r, employee))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ExtraShiftResponseDto> pendingForApprover(EssPrincipal principal) {
        List<ExtraShiftRequest> pending = lifecycle.pendingFor(extraShiftRequestKind, principal, (companyId, levels) ->
                extraShiftRequestRepository.findByCompanyIdAndStatusAndApprovalLevelIn(companyId, RequestStatus.PENDING, levels));
        Map<Long, Employee> owners = employeeLookupService.byIds(
                pending.stream().map(ExtraShiftRequest::getEmployeeId).collect(Collectors.toSet()));
        return pending.stream()
                .map(r -> ExtraShiftResponseDto.fromEntity(r, owners.get(r.getEmployeeId())))
                .toList();
    }

    public ExtraShiftResponseDto approve(EssPrincipal principal, Long id) {
        return toDto(lifecycle.approve(extraShiftRequestKind, id, principal));
    }

    public ExtraShiftResponseDto reject(EssPrincipal principal, Long id, String reason) {
        return toDto(lifecycle.reject(extraShiftRequestKind, id, principal, reason));
    }

    public ExtraShiftResponseDto cancel(EssPrincipal principal, Long id) {
        return toDto(lifecycle.cancel(extraShiftRequestKind, id, principal));
    }

    private ExtraShiftResponseDto toDto(ExtraShiftRequest request) {
        return ExtraShiftResponseDto.fromEntity(request, employeeLookupService.require(request.getEmployeeId()));
    }
}
