package hrms.hrmsbackend.service.claim;

import hrms.hrmsbackend.dto.request.claim.ClaimRequestDto;
import hrms.hrmsbackend.dto.response.claim.ClaimResponseDto;
import hrms.hrmsbackend.entity.mysql.claim.Claim;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.claim.ClaimRepository;
import hrms.hrmsbackend.service.approval.RequestLifecycleService;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.permission.ScopeResolver;
import hrms.hrmsbackend.util.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimService {

    private final ClaimRepository claimRepository;
    private final ClaimRequestKind claimRequestKind;
    private final RequestLifecycleService lifecycle;
    private final EmployeeLookupService employeeLookupService;
    private final ScopeResolver scopeResolver;
    private final TransactionRunner transactionRunner;

    public ClaimResponseDto submit(EssPrincipal principal, ClaimRequestDto dto) {
        if (dto.getClaimDate() == null || dto.getCategory() == null || dto.getCategory().isBlank() || dto.getAmount() == null) {
            throw EssException.validation("Claim date, category and amount are required");
        }
        if (dto.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw EssException.validation("Amount must be greater than zero");
        }
        return transactionRunner.inSerializable("submit claim", () -> {
            Employee employee = employeeLookupService.requireSelf(principal);
            Company company = scopeResolver.requireCompany(employee.getCompanyId());

            Claim claim = new Claim();
            claim.setClaimDate(dto.getClaimDate());
            claim.setCategory(dto.getCategory().trim());
            claim.setDescription(dto.getDescription());
            claim.setAmount(dto.getAmount());
            claim.setReceiptUrl(dto.getReceiptUrl());
            Claim saved = lifecycle.open(claimRequestKind, claim, employee, company);
            log.info("경비 청구 등록 - id: {}, employee: {}, amount: {}", saved.getId(), employee.getEmployeeCode(), saved.getAmount());
            return ClaimResponseDto.fromEntity(saved, employee);
        });
    }

    /**
     * 본인 청구 목록 (상태, 연도 필터는 선택)
     */
    @Transactional(readOnly = true)
    public List<ClaimResponseDto> myClaims(EssPrincipal principal, RequestStatus status, Integer year) {
        Employee employee = employeeLookupService.requireSelf(principal);
        return claimRepository.findByEmployeeIdOrderByCreatedAtDesc(employee.getId()).stream()
                .filter(c -> status == null || c.getStatus() == status)
                .filter(c -> year == null || c.getClaimDate().getYear() == year)
                .map(c -> ClaimResponseDto.fromEntity(c, employee))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ClaimResponseDto> pendingForApprover(EssPrincipal principal) {
        List<Claim> pending = lifecycle.pendingFor(claimRequestKind, principal, (companyId, levels) ->
                claimRepository.findByCompanyIdAndStatusAndApprovalLevelIn(companyId, RequestStatus.PENDING, levels));
        Map<Long, Employee> owners = employeeLookupService.byIds(
                pending.stream().map(Claim::getEmployeeId).collect(Collectors.toSet()));
        return pending.stream()
                .map(c -> ClaimResponseDto.fromEntity(c, owners.get(c.getEmployeeId())))
                .toList();
    }

    public ClaimResponseDto approve(EssPrincipal principal, Long id) {
        return toDto(lifecycle.approve(claimRequestKind, id, principal));
    }

    public ClaimResponseDto reject(EssPrincipal principal, Long id, String reason) {
        return toDto(lifecycle.reject(claimRequestKind, id, principal, reason));
    }

    public ClaimResponseDto cancel(EssPrincipal principal, Long id) {
        return toDto(lifecycle.cancel(claimRequestKind, id, principal));
    }

    private ClaimResponseDto toDto(Claim claim) {
        return ClaimResponseDto.fromEntity(claim, employeeLookupService.require(claim.getEmployeeId()));
    }
}
