package hrms.hrmsbackend.service.permission;

import hrms.hrmsbackend.entity.mysql.company.Company;
import hrms.hrmsbackend.enums.GroupingType;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Set;

/**
 * 요청 단위로 계산되는 관리 범위. 읽기 전용.
 */
@Getter
@Builder
public class Scope {

    private final Company company; // super_admin (회사 컨텍스트 없음) 은 null
    private final GroupingType grouping;

    @Builder.Default
    private final Set<Long> managedOutlets = Collections.emptySet();

    @Builder.Default
    private final Set<Long> managedDepartments = Collections.emptySet();

    // boss/director/admin: 회사 전체
    private final boolean companyWide;

    private final int hierarchyLevel;

    public Long getCompanyId() {
        return company != null ? company.getId() : null;
    }

    public boolean isOutletCompany() {
        return grouping == GroupingType.OUTLET;
    }

    public boolean sharesCompany(Long targetCompanyId) {
        // 회사 컨텍스트 없는 super_admin 은 모든 회사
        return company == null || company.getId().equals(targetCompanyId);
    }

    public boolean coversUnit(Long outletId, Long departmentId) {
        if (companyWide) {
            return true;
        }
        if (isOutletCompany()) {
            return outletId != null && managedOutlets.contains(outletId);
        }
        return departmentId != null && managedDepartments.contains(departmentId);
    }

    public boolean covers(Long targetCompanyId, Long outletId, Long departmentId) {
        return sharesCompany(targetCompanyId) && coversUnit(outletId, departmentId);
    }
}
