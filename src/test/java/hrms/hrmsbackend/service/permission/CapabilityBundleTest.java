package hrms.hrmsbackend.service.permission;

import hrms.hrmsbackend.enums.EmployeeRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CapabilityBundle 단위 테스트")
class CapabilityBundleTest {

    @Test
    @DisplayName("매장 회사 슈퍼바이저: 휴가/OT/교대 승인, 경비 승인은 불가")
    void outletSupervisor() {
        CapabilityBundle bundle = CapabilityBundle.compute(EmployeeRole.SUPERVISOR, true, false, List.of(3L));

        assertThat(bundle.isCanApproveLeave()).isTrue();
        assertThat(bundle.isCanApproveOt()).isTrue();
        assertThat(bundle.isCanApproveSwaps()).isTrue();
        assertThat(bundle.isCanApproveClaims()).isFalse();
        assertThat(bundle.isCanManageSchedule()).isTrue();
        assertThat(bundle.getManagedOutlets()).containsExactly(3L);
        assertThat(bundle.isMimix()).isTrue();
    }

    @Test
    @DisplayName("매장 회사 boss 만 경비 승인 가능")
    void outletBossApprovesClaims() {
        CapabilityBundle bundle = CapabilityBundle.compute(EmployeeRole.BOSS, true, false, List.of());

        assertThat(bundle.isCanApproveClaims()).isTrue();
        assertThat(bundle.isBossOrDirector()).isTrue();
    }

    @Test
    @DisplayName("사무실 회사 일반 직원은 스케줄 담당자일 때만 승인 권한")
    void officeScheduleManager() {
        CapabilityBundle plain = CapabilityBundle.compute(EmployeeRole.STAFF, false, false, List.of());
        CapabilityBundle manager = CapabilityBundle.compute(EmployeeRole.STAFF, false, true, List.of());

        assertThat(plain.isCanApproveLeave()).isFalse();
        assertThat(plain.isCanViewTeam()).isFalse();
        assertThat(manager.isCanApproveLeave()).isTrue();
        assertThat(manager.isCanManageSchedule()).isTrue();
        assertThat(manager.isIndoorSalesManager()).isTrue();
        assertThat(manager.isCanApproveSwaps()).isFalse();
    }

    @Test
    @DisplayName("사무실 회사 매니저는 경비 승인 가능, 휴가 승인은 불가")
    void officeManagerClaimsOnly() {
        CapabilityBundle bundle = CapabilityBundle.compute(EmployeeRole.MANAGER, false, false, List.of());

        assertThat(bundle.isCanApproveClaims()).isTrue();
        assertThat(bundle.isCanApproveLeave()).isFalse();
    }

    @Test
    @DisplayName("관리자는 모든 기능 플래그를 가진다")
    void adminHasEverything() {
        CapabilityBundle bundle = CapabilityBundle.forAdmin(true, List.of());

        for (Capability capability : Capability.values()) {
            assertThat(bundle.has(capability)).as(capability.name()).isTrue();
        }
    }
}
