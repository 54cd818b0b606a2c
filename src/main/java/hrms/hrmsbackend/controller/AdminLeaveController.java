package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.leave.EncashmentRequestDto;
import hrms.hrmsbackend.dto.response.leave.EncashmentResponseDto;
import hrms.hrmsbackend.service.leave.LeaveBalanceService;
import hrms.hrmsbackend.service.leave.LeaveRequestService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * 관리자 전용 휴가 기능 (/api/v1/admin/** 는 ADMIN, SUPER_ADMIN 만 접근)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/leave")
@RequiredArgsConstructor
public class AdminLeaveController {

    private final LeaveRequestService leaveRequestService;

    @PostMapping("/encashment")
    public ResponseEntity<EncashmentResponseDto> encashment(@AuthenticationPrincipal EssPrincipal principal,
                                                            @RequestBody @Valid EncashmentRequestDto dto) {
        return ResponseEntity.ok(leaveRequestService.encashment(principal, dto));
    }

    // 연도 잔여일 초기화 + 이월
    @PostMapping("/initialize-year")
    public ResponseEntity<LeaveBalanceService.YearInitResult> initializeYear(@AuthenticationPrincipal EssPrincipal principal,
                                                                           @RequestParam int year) {
        LeaveBalanceService.YearInitResult result = leaveRequestService.initializeYear(principal, year);
        log.info("휴가 연도 초기화 - company: {}, year: {}, created: {}, skipped: {}",
                principal.getCompanyId(), year, result.getCreated(), result.getSkipped());
        return ResponseEntity.ok(result);
    }
}
