package hrms.hrmsbackend.service.permission;

import hrms.hrmsbackend.enums.EmployeeRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HierarchyLevelResolver 단위 테스트")
class HierarchyLevelResolverTest {

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "Boss, 100",
            "Director, 90",
            "Manager, 80",
            "Supervisor, 60",
            "Assistant Supervisor, 40",
            "Asst. Supervisor, 40",
            "asst_spv, 40",
            "Service Crew, 20",
            "Part-Timer, 20",
            "Cashier, 20"
    })
    void resolvesPositionTextExactly(String position, int expected) {
        assertThat(HierarchyLevelResolver.resolve(null, null, position)).isEqualTo(expected);
    }

    @Test
    @DisplayName("position.role 이 employee_role 보다 우선한다")
    void positionRoleWins() {
        assertThat(HierarchyLevelResolver.resolve("manager", EmployeeRole.SUPERVISOR, "Crew")).isEqualTo(80);
    }

    @Test
    @DisplayName("employee_role 이 직책 자유 입력값보다 우선한다")
    void employeeRoleBeforePositionText() {
        assertThat(HierarchyLevelResolver.resolve(null, EmployeeRole.SUPERVISOR, "Director of Fun")).isEqualTo(60);
    }

    @Test
    @DisplayName("staff 역할은 테이블의 crew 레벨로 해석된다")
    void staffRoleIsCrewLevel() {
        assertThat(HierarchyLevelResolver.resolve(null, EmployeeRole.STAFF, "Outlet Manager")).isEqualTo(20);
    }

    @Test
    @DisplayName("부분 일치는 긴 별칭부터 비교한다")
    void substringPrefersLongestAlias() {
        assertThat(HierarchyLevelResolver.resolve(null, null, "Senior Assistant Supervisor")).isEqualTo(40);
        assertThat(HierarchyLevelResolver.resolve(null, null, "Area Manager")).isEqualTo(80);
    }

    @Test
    @DisplayName("알 수 없는 직책은 기본 레벨 10")
    void unknownFallsBackToDefault() {
        assertThat(HierarchyLevelResolver.resolve(null, null, "Intern")).isEqualTo(HierarchyLevelResolver.DEFAULT);
        assertThat(HierarchyLevelResolver.resolve(null, null, null)).isEqualTo(HierarchyLevelResolver.DEFAULT);
    }
}
