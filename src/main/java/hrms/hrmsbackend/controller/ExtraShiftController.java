package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.RejectRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ExtraShiftRequestDto;
import hrms.hrmsbackend.dto.response.schedule.ExtraShiftResponseDto;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.schedule.ExtraShiftRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/extra-shifts")
@RequiredArgsConstructor
public class ExtraShiftController {

    private final ExtraShiftRequestService extraShiftRequestService;

    @PostMapping
    public ResponseEntity<ExtraShiftResponseDto> submit(@AuthenticationPrincipal EssPrincipal principal,
                                                        @RequestBody @Valid ExtraShiftRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(extraShiftRequestService.submit(principal, dto));
    }

    @GetMapping("/my")
    public ResponseEntity<List<ExtraShiftResponseDto>> myRequests(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(extraShiftRequestService.myRequests(principal));
    }

    @GetMapping("/pending")
    public ResponseEntity<List<ExtraShiftResponseDto>> pending(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(extraShiftRequestService.pendingForApprover(principal));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ExtraShiftResponseDto> approve(@AuthenticationPrincipal EssPrincipal principal,
                                                         @PathVariable Long id) {
        return ResponseEntity.ok(extraShiftRequestService.approve(principal, id));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<ExtraShiftResponseDto> reject(@AuthenticationPrincipal EssPrincipal principal,
                                                        @PathVariable Long id,
                                                        @RequestBody @Valid RejectRequestDto dto) {
        return ResponseEntity.ok(extraShiftRequestService.reject(principal, id, dto.getReason()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ExtraShiftResponseDto> cancel(@AuthenticationPrincipal EssPrincipal principal,
                                                        @PathVariable Long id) {
        return ResponseEntity.ok(extraShiftRequestService.cancel(principal, id));
    }
}
