package hrms.hrmsbackend.service.letter;

import hrms.hrmsbackend.dto.request.letter.LetterIssueRequestDto;
import hrms.hrmsbackend.dto.response.letter.LetterResponseDto;
import hrms.hrmsbackend.entity.mysql.Letter;
import hrms.hrmsbackend.entity.mysql.employee.Employee;
import hrms.hrmsbackend.enums.NotificationType;
import hrms.hrmsbackend.exception.EssException;
import hrms.hrmsbackend.repository.mysql.LetterRepository;
import hrms.hrmsbackend.service.employee.EmployeeLookupService;
import hrms.hrmsbackend.service.notification.NotificationService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.template.NotificationTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 인사 서신 발행과 열람
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LetterService {

    private static final String REFERENCE_TYPE = "letter";

    private final LetterRepository letterRepository;
    private final EmployeeLookupService employeeLookupService;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public LetterResponseDto issue(EssPrincipal principal, LetterIssueRequestDto dto) {
        if (!principal.isAdmin()) {
            throw EssException.forbidden("Admin access required");
        }
        Employee employee = employeeLookupService.require(dto.getEmployeeId());
        employeeLookupService.requireSameCompany(principal, employee);

        Letter letter = letterRepository.save(Letter.builder()
                .employeeId(employee.getId())
                .companyId(employee.getCompanyId())
                .letterType(dto.getLetterType())
                .subject(dto.getSubject())
                .content(dto.getContent())
                .issuedBy(principal.getId())
                .build());

        notificationService.send(employee.getId(), NotificationType.LETTER, NotificationTemplate.LETTER_ISSUED,
                Map.of("subject", letter.getSubject()), REFERENCE_TYPE, letter.getId());
        log.info("서신 발행 - id: {}, employee: {}, by: {}", letter.getId(), employee.getEmployeeCode(), principal.getLoginId());
        return LetterResponseDto.fromEntity(letter);
    }

    @Transactional(readOnly = true)
    public List<LetterResponseDto> myLetters(EssPrincipal principal) {
        Employee employee = employeeLookupService.requireSelf(principal);
        return letterRepository.findByEmployeeIdOrderByCreatedAtDesc(employee.getId()).stream()
                .map(LetterResponseDto::fromEntity)
                .toList();
    }

    // 열람 시 읽음 처리
    @Transactional
    public LetterResponseDto open(EssPrincipal principal, Long letterId) {
        Employee employee = employeeLookupService.requireSelf(principal);
        Letter letter = letterRepository.findByIdAndEmployeeId(letterId, employee.getId())
                .orElseThrow(() -> EssException.notFound("Letter"));
        if (!Boolean.TRUE.equals(letter.getRead())) {
            letter.setRead(true);
            letter.setReadAt(LocalDateTime.now(clock));
            letter = letterRepository.save(letter);
        }
        return LetterResponseDto.fromEntity(letter);
    }

    @Transactional(readOnly = true)
    public long unreadCount(EssPrincipal principal) {
        Employee employee = employeeLookupService.requireSelf(principal);
        return letterRepository.countByEmployeeIdAndReadFalse(employee.getId());
    }
}
