package hrms.hrmsbackend.service.permission;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.entity.mysql.position.Position;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.repository.mysql.position.PositionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 직책 문자열 → 계층 레벨 변환.
 * 판정 순서: position.role → employee_role → position 자유 입력값 (정확 일치 후 부분 일치)
 */
@Component
@RequiredArgsConstructor
public class HierarchyLevelResolver {

    public static final int TOP = 100;
    public static final int DIRECTOR = 90;
    public static final int MANAGER = 80;
    public static final int SUPERVISOR = 60;
    public static final int ASSISTANT_SUPERVISOR = 40;
    public static final int CREW = 20;
    public static final int DEFAULT = 10;

    private static final Map<String, Integer> TABLE = new LinkedHashMap<>();

    // 부분 일치는 긴 별칭부터 ("assistant supervisor" 가 "supervisor" 보다 먼저)
    private static final List<Map.Entry<String, Integer>> BY_LENGTH;

    static {
        TABLE.put("admin", TOP);
        TABLE.put("super admin", TOP);
        TABLE.put("superadmin", TOP);
        TABLE.put("boss", TOP);
        TABLE.put("director", DIRECTOR);
        TABLE.put("manager", MANAGER);
        TABLE.put("supervisor", SUPERVISOR);
        TABLE.put("assistant supervisor", ASSISTANT_SUPERVISOR);
        TABLE.put("asst supervisor", ASSISTANT_SUPERVISOR);
        TABLE.put("ast supervisor", ASSISTANT_SUPERVISOR);
        TABLE.put("assistant supervisior", ASSISTANT_SUPERVISOR);
        TABLE.put("asst supervisior", ASSISTANT_SUPERVISOR);
        TABLE.put("assistant spv", ASSISTANT_SUPERVISOR);
        TABLE.put("asst spv", ASSISTANT_SUPERVISOR);
        TABLE.put("service crew", CREW);
        TABLE.put("part timer", CREW);
        TABLE.put("part time", CREW);
        TABLE.put("parttimer", CREW);
        TABLE.put("cashier", CREW);
        TABLE.put("barista", CREW);
        TABLE.put("staff", CREW);
        TABLE.put("crew", CREW);

        BY_LENGTH = TABLE.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, Integer> e) -> e.getKey().length()).reversed())
                .toList();
    }

    private final PositionRepository positionRepository;

    /**
     * 직원의 계층 레벨 (position 테이블 조회는 positionCache 사용)
     */
    public int levelOf(Employee employee) {
        String positionRole = null;
        if (employee.getPositionId() != null) {
            positionRole = positionRepository.findCachedById(employee.getPositionId())
                    .map(Position::getRole)
                    .orElse(null);
        }
        return resolve(positionRole, employee.getEmployeeRole(), employee.getPosition());
    }

    public int levelOf(EssPrincipal principal) {
        if (principal.isAdmin()) {
            return TOP;
        }
        String positionRole = null;
        if (principal.getPositionId() != null) {
            positionRole = positionRepository.findCachedById(principal.getPositionId())
                    .map(Position::getRole)
                    .orElse(null);
        }
        return resolve(positionRole, principal.getEmployeeRole(), principal.getPosition());
    }

    public static int resolve(String positionRole, EmployeeRole employeeRole, String positionText) {
        OptionalInt level = exact(positionRole);
        if (level.isPresent()) {
            return level.getAsInt();
        }
        if (employeeRole != null) {
            level = exact(employeeRole.getValue());
            if (level.isPresent()) {
                return level.getAsInt();
            }
        }
        level = exact(positionText);
        if (level.isPresent()) {
            return level.getAsInt();
        }
        return substring(positionText).orElse(DEFAULT);
    }

    static OptionalInt exact(String value) {
        String key = normalize(value);
        if (key.isEmpty()) {
            return OptionalInt.empty();
        }
        Integer level = TABLE.get(key);
        return level != null ? OptionalInt.of(level) : OptionalInt.empty();
    }

    static OptionalInt substring(String value) {
        String key = normalize(value);
        if (key.isEmpty()) {
            return OptionalInt.empty();
        }
        String padded = " " + key + " ";
        for (Map.Entry<String, Integer> entry : BY_LENGTH) {
            if (padded.contains(" " + entry.getKey() + " ")) {
                return OptionalInt.of(entry.getValue());
            }
        }
        return OptionalInt.empty();
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
                .replace('_', ' ')
                .replace('-', ' ')
                .replace(".", "")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
