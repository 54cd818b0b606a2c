package hrms.hrmsbackend.service.permission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import hrms.hrmsbackend.enums.EmployeeRole;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 로그인/세션 갱신 응답에 포함되는 권한 플래그 묶음
 */
@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CapabilityBundle {

    private final String employeeRole;
    private final boolean canApproveLeave;
    private final boolean canApproveOt;
    private final boolean canApproveSwaps;
    private final boolean canApproveClaims;
    private final boolean canViewTeam;
    private final boolean canManageSchedule;

    @Builder.Default
    private final List<Long> managedOutlets = new ArrayList<>();

    @JsonProperty("is_mimix")
    private final boolean mimix;

    @JsonProperty("is_boss_or_director")
    private final boolean bossOrDirector;

    @JsonProperty("is_indoor_sales_manager")
    private final boolean indoorSalesManager;

    public static CapabilityBundle compute(EmployeeRole role, boolean outletCompany, boolean scheduleManager,
                                           List<Long> managedOutlets) {
        EmployeeRole r = role != null ? role : EmployeeRole.STAFF;
        boolean elevated = r.isApproverRole();
        boolean officeScheduleManager = !outletCompany && scheduleManager;

        boolean approveLeave = (elevated && outletCompany) || officeScheduleManager;
        boolean approveOt = approveLeave;
        boolean approveClaims = outletCompany
                ? r.isBossOrDirector()
                : (r == EmployeeRole.SUPERVISOR || r == EmployeeRole.MANAGER);

        return CapabilityBundle.builder()
                .employeeRole(r.getValue())
                .canApproveLeave(approveLeave)
                .canApproveOt(approveOt)
                .canApproveSwaps(elevated && outletCompany)
                .canApproveClaims(approveClaims)
                .canViewTeam(approveLeave || approveOt)
                .canManageSchedule((approveLeave && outletCompany) || officeScheduleManager)
                .managedOutlets(managedOutlets != null ? new ArrayList<>(managedOutlets) : new ArrayList<>())
                .mimix(outletCompany)
                .bossOrDirector(r.isBossOrDirector())
                .indoorSalesManager(officeScheduleManager)
                .build();
    }

    /**
     * 관리자 계정은 모든 승인 권한을 가진다
     */
    public static CapabilityBundle forAdmin(boolean outletCompany, List<Long> managedOutlets) {
        return CapabilityBundle.builder()
                .employeeRole("admin")
                .canApproveLeave(true)
                .canApproveOt(true)
                .canApproveSwaps(true)
                .canApproveClaims(true)
                .canViewTeam(true)
                .canManageSchedule(true)
                .managedOutlets(managedOutlets != null ? new ArrayList<>(managedOutlets) : new ArrayList<>())
                .mimix(outletCompany)
                .bossOrDirector(false)
                .indoorSalesManager(false)
                .build();
    }

    public boolean has(Capability capability) {
        return switch (capability) {
            case APPROVE_LEAVE -> canApproveLeave;
            case APPROVE_OT -> canApproveOt;
            case APPROVE_SWAPS -> canApproveSwaps;
            case APPROVE_CLAIMS -> canApproveClaims;
            case VIEW_TEAM -> canViewTeam;
            case MANAGE_SCHEDULE -> canManageSchedule;
        };
    }
}
