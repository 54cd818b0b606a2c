package hrms.hrmsbackend.dto.response.profile;

import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.EmployeeRole;
import hrms.hrmsbackend.enums.WorkType;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class ProfileResponseDto {
    private Long id;
    private String employeeCode;
    private String name;
    private Long companyId;
    private Long outletId;
    private Long departmentId;
    private String position;
    private EmployeeRole employeeRole;
    private WorkType workType;
    private LocalDate joinDate;
    private String phone;
    private String email;
    private String address;
    private String emergencyContactName;
    private String emergencyContactPhone;

    public static ProfileResponseDto fromEntity(Employee employee) {
        return ProfileResponseDto.builder()
                .id(employee.getId())
                .employeeCode(employee.getEmployeeCode())
                .name(employee.getName())
                .companyId(employee.getCompanyId())
                .outletId(employee.getOutletId())
                .departmentId(employee.getDepartmentId())
                .position(employee.getPosition())
                .employeeRole(employee.getEmployeeRole())
                .workType(employee.getWorkType())
                .joinDate(employee.getJoinDate())
                .phone(employee.getPhone())
                .email(employee.getEmail())
                .address(employee.getAddress())
                .emergencyContactName(employee.getEmergencyContactName())
                .emergencyContactPhone(employee.getEmergencyContactPhone())
                .build();
    }
}
