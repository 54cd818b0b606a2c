package hrms.hrmsbackend.service.claim;

import hrms.hrmsbackend.entity.mysql.claim.Claim;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestKind;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.claim.ClaimRepository;
import hrms.hrmsbackend.service.approval.InitialDecision;
import hrms.hrmsbackend.service.approval.RequestKindHandler;
import hrms.hrmsbackend.service.permission.Capability;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 경비 청구는 직급과 무관하게 1단계부터 시작한다
 */
@Component
@RequiredArgsConstructor
public class ClaimRequestKind implements RequestKindHandler<Claim> {

    private final ClaimRepository claimRepository;

    @Override
    public RequestKind kind() {
        return RequestKind.CLAIM;
    }

    @Override
    public NotificationType notificationType() {
        return NotificationType.CLAIM;
    }

    @Override
    public Capability capability() {
        return Capability.APPROVE_CLAIMS;
    }

    @Override
    public Claim lockForTransition(Long id) {
        return claimRepository.findWithLockById(id)
                .orElseThrow(() -> EssException.notFound("Claim"));
    }

    @Override
    public Claim save(Claim request) {
        return claimRepository.save(request);
    }

    @Override
    public String summarize(Claim request) {
        return request.getCategory() + " " + request.getAmount().toPlainString() + " on " + request.getClaimDate();
    }

    @Override
    public InitialDecision onCreate(Claim request, Employee owner, Company company) {
        return InitialDecision.atLevel(1);
    }
}
