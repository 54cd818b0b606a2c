package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.RejectRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ShiftSwapRequestDto;
import hrms.hrmsbackend.dto.request.schedule.SwapResponseRequestDto;
import hrms.hrmsbackend.dto.response.schedule.ShiftSwapResponseDto;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.schedule.ShiftSwapService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/shift-swaps")
@RequiredArgsConstructor
public class ShiftSwapController {

    private final ShiftSwapService shiftSwapService;

    @PostMapping
    public ResponseEntity<ShiftSwapResponseDto> request(@AuthenticationPrincipal EssPrincipal principal,
                                                        @RequestBody @Valid ShiftSwapRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(shiftSwapService.request(principal, dto));
    }

    @GetMapping("/my")
    public ResponseEntity<List<ShiftSwapResponseDto>> mySwaps(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(shiftSwapService.mySwaps(principal));
    }

    // 교대 상대의 수락/거절
    @PostMapping("/{id}/respond")
    public ResponseEntity<ShiftSwapResponseDto> respond(@AuthenticationPrincipal EssPrincipal principal,
                                                        @PathVariable Long id,
                                                        @RequestBody SwapResponseRequestDto dto) {
        return ResponseEntity.ok(shiftSwapService.respond(principal, id, dto.getResponse()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ShiftSwapResponseDto> cancel(@AuthenticationPrincipal EssPrincipal principal,
                                                       @PathVariable Long id) {
        return ResponseEntity.ok(shiftSwapService.cancel(principal, id));
    }

    @GetMapping("/pending")
    public ResponseEntity<List<ShiftSwapResponseDto>> pending(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(shiftSwapService.pendingForApprover(principal));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ShiftSwapResponseDto> approve(@AuthenticationPrincipal EssPrincipal principal,
                                                        @PathVariable Long id) {
        return ResponseEntity.ok(shiftSwapService.approve(principal, id));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<ShiftSwapResponseDto> reject(@AuthenticationPrincipal EssPrincipal principal,
                                                       @PathVariable Long id,
                                                       @RequestBody @Valid RejectRequestDto dto) {
        return ResponseEntity.ok(shiftSwapService.reject(principal, id, dto.getReason()));
    }
}
