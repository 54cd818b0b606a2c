package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.attendance.OtBatchRequestDto;
import hrms.hrmsbackend.dto.response.attendance.ClockInRecordResponseDto;
import hrms.hrmsbackend.dto.response.attendance.OtBatchResultDto;
import hrms.hrmsbackend.dto.response.attendance.OtSummaryResponseDto;
import hrms.hrmsbackend.service.attendance.OtApprovalService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ot-approval")
@RequiredArgsConstructor
public class OtApprovalController {

    private final OtApprovalService otApprovalService;

    @GetMapping("/pending")
    public ResponseEntity<List<ClockInRecordResponseDto>> pending(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(otApprovalService.pending(principal));
    }

    // 일괄 승인/반려 (단일 트랜잭션)
    @PostMapping("/batch")
    public ResponseEntity<OtBatchResultDto> batch(@AuthenticationPrincipal EssPrincipal principal,
                                                  @RequestBody OtBatchRequestDto dto) {
        return ResponseEntity.ok(otApprovalService.batch(principal, dto));
    }

    @GetMapping("/summary")
    public ResponseEntity<OtSummaryResponseDto> summary(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(otApprovalService.summary(principal));
    }
}
