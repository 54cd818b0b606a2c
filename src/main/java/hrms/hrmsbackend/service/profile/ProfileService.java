package hrms.hrmsbackend.service.profile;

import hrms.hrmsbackend.dto.request.profile.ProfileUpdateRequestDto;
import hrms.hrmsbackend.dto.response.profile.ProfileResponseDto;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.repository.mysql.employee.EmployeeRepository;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    private final EmployeeRepository employeeRepository;
    private final EmployeeLookupService employeeLookupService;

    @Transactional(readOnly = true)
    public ProfileResponseDto myProfile(EssPrincipal principal) {
        return ProfileResponseDto.fromEntity(employeeLookupService.requireSelf(principal));
    }

    @Transactional
    public ProfileResponseDto updateContact(EssPrincipal principal, ProfileUpdateRequestDto dto) {
        Employee employee = employeeLookupService.requireSelf(principal);
        if (dto.getPhone() != null) {
            employee.setPhone(dto.getPhone().trim());
        }
        if (dto.getEmail() != null) {
            employee.setEmail(dto.getEmail().trim());
        }
        if (dto.getAddress() != null) {
            employee.setAddress(dto.getAddress());
        }
        if (dto.getEmergencyContactName() != null) {
            employee.setEmergencyContactName(dto.getEmergencyContactName());
        }
        if (dto.getEmergencyContactPhone() != null) {
            employee.setEmergencyContactPhone(dto.getEmergencyContactPhone().trim());
        }
        Employee saved = employeeRepository.save(employee);
        log.info("연락처 수정 - employee: {}", saved.getEmployeeCode());
        return ProfileResponseDto.fromEntity(saved);
    }
}
