package hrms.hrmsbackend.service.approval;

import hrms.hrmsbackend.entity.mysql.approval.ApprovableRequest;
import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.enums.RequestKind;
import hrms.hrmsbackend.service.permission.Capability;

/**
 * 요청 종류별 훅. 승인 흐름은 공통이고 부수 효과만 종류마다 다르다.
 */
public interface RequestKindHandler<T extends ApprovableRequest> {

    RequestKind kind();

    NotificationType notificationType();

    // 승인자에게 요구되는 기능 플래그
    Capability capability();

    // 전이 전에 행 잠금으로 다시 읽는다
    T lockForTransition(Long id);

    T save(T request);

    // 알림 본문에 들어가는 요약 (예: "Annual Leave 2025-06-10 ~ 2025-06-12")
    String summarize(T request);

    default InitialDecision onCreate(T request, Employee owner, Company company) {
        return InitialDecision.atLevel(InitialApprovalPolicy.initialLevel(company, owner));
    }

    // pending → approved
    default void onApproved(T request) {
    }

    default void onRejected(T request) {
    }

    // approved → cancelled / reverted
    default void onReversed(T request) {
    }
}
