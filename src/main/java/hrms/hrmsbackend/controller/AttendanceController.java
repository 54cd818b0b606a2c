package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.attendance.ClockActionRequestDto;
import hrms.hrmsbackend.dto.response.attendance.AttendanceHistoryResponseDto;
import hrms.hrmsbackend.dto.response.attendance.ClockInRecordResponseDto;
import hrms.hrmsbackend.dto.response.attendance.ClockStatusResponseDto;
import hrms.hrmsbackend.service.attendance.ClockInService;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/attendance")
@RequiredArgsConstructor
public class AttendanceController {

    private final ClockInService clockInService;

    @GetMapping("/status")
    public ResponseEntity<ClockStatusResponseDto> status(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(clockInService.status(principal));
    }

    /**
     * 출퇴근 기록 (clock_in_1 → clock_out_1 → clock_in_2 → clock_out_2)
     */
    @PostMapping("/clock")
    public ResponseEntity<ClockInRecordResponseDto> punch(@AuthenticationPrincipal EssPrincipal principal,
                                                          @RequestBody @Valid ClockActionRequestDto dto) {
        return ResponseEntity.ok(clockInService.punch(principal, dto));
    }

    @GetMapping("/history")
    public ResponseEntity<AttendanceHistoryResponseDto> history(
            @AuthenticationPrincipal EssPrincipal principal,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(clockInService.history(principal, from, to));
    }
}
