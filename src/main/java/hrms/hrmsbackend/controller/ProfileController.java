package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.profile.ProfileUpdateRequestDto;
import hrms.hrmsbackend.dto.response.profile.ProfileResponseDto;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.profile.ProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;

    @GetMapping
    public ResponseEntity<ProfileResponseDto> myProfile(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(profileService.myProfile(principal));
    }

    @PatchMapping
    public ResponseEntity<ProfileResponseDto> updateContact(@AuthenticationPrincipal EssPrincipal principal,
                                                            @RequestBody @Valid ProfileUpdateRequestDto dto) {
        return ResponseEntity.ok(profileService.updateContact(principal, dto));
    }
}
