package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.letter.LetterIssueRequestDto;
import hrms.hrmsbackend.dto.response.letter.LetterResponseDto;
import hrms.hrmsbackend.service.letter.LetterService;
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
@RequiredArgsConstructor
public class LetterController {

    private final LetterService letterService;

    @GetMapping("/api/v1/letters")
    public ResponseEntity<List<LetterResponseDto>> myLetters(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(letterService.myLetters(principal));
    }

    // 열람 = 읽음 처리
    @GetMapping("/api/v1/letters/{id}")
    public ResponseEntity<LetterResponseDto> open(@AuthenticationPrincipal EssPrincipal principal, @PathVariable Long id) {
        return ResponseEntity.ok(letterService.open(principal, id));
    }

    @GetMapping("/api/v1/letters/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(Map.of("count", letterService.unreadCount(principal)));
    }

    @PostMapping("/api/v1/admin/letters")
    public ResponseEntity<LetterResponseDto> issue(@AuthenticationPrincipal EssPrincipal principal,
                                                   @RequestBody @Valid LetterIssueRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(letterService.issue(principal, dto));
    }
}
