package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.RejectRequestDto;
import hrms.hrmsbackend.dto.request.claim.ClaimRequestDto;
import hrms.hrmsbackend.dto.response.claim.ClaimResponseDto;
import hrms.hrmsbackend.enums.RequestStatus;
import hrms.hrmsbackend.service.claim.ClaimService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/claims")
@RequiredArgsConstructor
public class ClaimController {

    private final ClaimService claimService;

    @PostMapping
    public ResponseEntity<ClaimResponseDto> submit(@AuthenticationPrincipal EssPrincipal principal,
                                                   @RequestBody @Valid ClaimRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(claimService.submit(principal, dto));
    }

    @GetMapping("/my")
    public ResponseEntity<List<ClaimResponseDto>> myClaims(@AuthenticationPrincipal EssPrincipal principal,
                                                           @RequestParam(required = false) RequestStatus status,
                                                           @RequestParam(required = false) Integer year) {
        return ResponseEntity.ok(claimService.myClaims(principal, status, year));
    }

    @GetMapping("/pending")
    public ResponseEntity<List<ClaimResponseDto>> pending(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(claimService.pendingForApprover(principal));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ClaimResponseDto> approve(@AuthenticationPrincipal EssPrincipal principal,
                                                    @PathVariable Long id) {
        return ResponseEntity.ok(claimService.approve(principal, id));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<ClaimResponseDto> reject(@AuthenticationPrincipal EssPrincipal principal,
                                                   @PathVariable Long id,
                                                   @RequestBody @Valid RejectRequestDto dto) {
        return ResponseEntity.ok(claimService.reject(principal, id, dto.getReason()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ClaimResponseDto> cancel(@AuthenticationPrincipal EssPrincipal principal,
                                                   @PathVariable Long id) {
        return ResponseEntity.ok(claimService.cancel(principal, id));
    }
}
