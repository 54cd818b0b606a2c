package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.RejectRequestDto;
import hrms.hrmsbackend.dto.request.leave.LeaveApplyRequestDto;
import hrms.hrmsbackend.dto.response.leave.LeaveBalanceResponseDto;
import hrms.hrmsbackend.dto.response.leave.LeaveRequestResponseDto;
import hrms.hrmsbackend.dto.response.leave.LeaveTypeResponseDto;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.service.leave.LeaveRequestService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/leave")
@RequiredArgsConstructor
public class LeaveController {

    private final LeaveRequestService leaveRequestService;

    @PostMapping
    public ResponseEntity<LeaveRequestResponseDto> apply(@AuthenticationPrincipal EssPrincipal principal,
                                                         @RequestBody @Valid LeaveApplyRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(leaveRequestService.apply(principal, dto));
    }

    /**
     * 내 휴가 신청 목록 (status, year 선택)
     */
    @GetMapping("/my")
    public ResponseEntity<List<LeaveRequestResponseDto>> myRequests(@AuthenticationPrincipal EssPrincipal principal,
                                                                    @RequestParam(required = false) RequestStatus status,
                                                                    @RequestParam(required = false) Integer year) {
        return ResponseEntity.ok(leaveRequestService.myRequests(principal, status, year));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LeaveRequestResponseDto> getRequest(@AuthenticationPrincipal EssPrincipal principal,
                                                              @PathVariable Long id) {
        return ResponseEntity.ok(leaveRequestService.getRequest(principal, id));
    }

    @GetMapping("/types")
    public ResponseEntity<List<LeaveTypeResponseDto>> leaveTypes(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(leaveRequestService.leaveTypes(principal));
    }

    @GetMapping("/balances")
    public ResponseEntity<List<LeaveBalanceResponseDto>> balances(@AuthenticationPrincipal EssPrincipal principal,
                                                                  @RequestParam(required = false) Integer year) {
        return ResponseEntity.ok(leaveRequestService.balances(principal, year));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<LeaveRequestResponseDto> cancel(@AuthenticationPrincipal EssPrincipal principal,
                                                          @PathVariable Long id) {
        return ResponseEntity.ok(leaveRequestService.cancel(principal, id));
    }

    // 자동 승인된 본인 휴가 되돌리기
    @PostMapping("/{id}/revert")
    public ResponseEntity<LeaveRequestResponseDto> revert(@AuthenticationPrincipal EssPrincipal principal,
                                                          @PathVariable Long id) {
        return ResponseEntity.ok(leaveRequestService.revert(principal, id));
    }

    @GetMapping("/team/pending")
    public ResponseEntity<List<LeaveRequestResponseDto>> teamPending(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(leaveRequestService.pendingForApprover(principal));
    }

    @GetMapping("/team/pending-count")
    public ResponseEntity<Map<String, Long>> teamPendingCount(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(Map.of("count", leaveRequestService.pendingCount(principal)));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<LeaveRequestResponseDto> approve(@AuthenticationPrincipal EssPrincipal principal,
                                                           @PathVariable Long id) {
        return ResponseEntity.ok(leaveRequestService.approve(principal, id));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<LeaveRequestResponseDto> reject(@AuthenticationPrincipal EssPrincipal principal,
                                                          @PathVariable Long id,
                                                          @RequestBody @Valid RejectRequestDto dto) {
        return ResponseEntity.ok(leaveRequestService.reject(principal, id, dto.getReason()));
    }
}
