package hrms.hrmsbackend.controller;

import hrms.hrmsbackend.dto.request.schedule.ScheduleAssignRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ScheduleBulkAssignRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ScheduleBulkCreateRequestDto;
import hrms.hrmsbackend.dto.request.schedule.ScheduleCreateRequestDto;
import hrms.hrmsbackend.dto.response.ResponseDto;
import hrms.hrmsbackend.dto.response.schedule.BulkScheduleResultDto;
import hrms.hrmsbackend.dto.response.schedule.ScheduleEditPermissionDto;
import hrms.hrmsbackend.dto.response.schedule.ScheduleResponseDto;
import hrms.hrmsbackend.dto.response.schedule.ShiftTemplateResponseDto;
import hrms.hrmsbackend.dto.response.schedule.WeeklyRosterDto;
import hrms.hrmsbackend.dto.response.schedule.WeeklyValidationDto;
import hrms.hrmsbackend.service.permission.EssPrincipal;
import hrms.hrmsbackend.service.schedule.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @GetMapping("/my")
    public ResponseEntity<List<ScheduleResponseDto>> mySchedules(
            @AuthenticationPrincipal EssPrincipal principal,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(scheduleService.mySchedules(principal, from, to));
    }

    @GetMapping("/templates")
    public ResponseEntity<List<ShiftTemplateResponseDto>> templates(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(scheduleService.templates(principal));
    }

    // T+2 편집 제한 안내
    @GetMapping("/edit-permission")
    public ResponseEntity<ScheduleEditPermissionDto> editPermission(@AuthenticationPrincipal EssPrincipal principal) {
        return ResponseEntity.ok(scheduleService.editPermission(principal));
    }

    @PostMapping
    public ResponseEntity<ScheduleResponseDto> create(@AuthenticationPrincipal EssPrincipal principal,
                                                      @RequestBody @Valid ScheduleCreateRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleService.create(principal, dto));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ScheduleResponseDto> update(@AuthenticationPrincipal EssPrincipal principal,
                                                      @PathVariable Long id,
                                                      @RequestBody @Valid ScheduleCreateRequestDto dto) {
        return ResponseEntity.ok(scheduleService.update(principal, id, dto));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ResponseDto> delete(@AuthenticationPrincipal EssPrincipal principal, @PathVariable Long id) {
        scheduleService.delete(principal, id);
        return ResponseEntity.ok(ResponseDto.success());
    }

    @PostMapping("/assign")
    public ResponseEntity<ScheduleResponseDto> assign(@AuthenticationPrincipal EssPrincipal principal,
                                                      @RequestBody @Valid ScheduleAssignRequestDto dto) {
        return ResponseEntity.ok(scheduleService.assign(principal, dto));
    }

    @PostMapping("/bulk-create")
    public ResponseEntity<BulkScheduleResultDto> bulkCreate(@AuthenticationPrincipal EssPrincipal principal,
                                                            @RequestBody @Valid ScheduleBulkCreateRequestDto dto) {
        return ResponseEntity.ok(scheduleService.bulkCreate(principal, dto));
    }

    @PostMapping("/bulk-assign")
    public ResponseEntity<BulkScheduleResultDto> bulkAssign(@AuthenticationPrincipal EssPrincipal principal,
                                                            @RequestBody @Valid ScheduleBulkAssignRequestDto dto) {
        return ResponseEntity.ok(scheduleService.bulkAssign(principal, dto));
    }

    /**
     * 아울렛/부서 주간 근무표
     */
    @GetMapping("/roster")
    public ResponseEntity<WeeklyRosterDto> weeklyRoster(
            @AuthenticationPrincipal EssPrincipal principal,
            @RequestParam(required = false) Long outletId,
            @RequestParam(required = false) Long departmentId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate) {
        return ResponseEntity.ok(scheduleService.weeklyRoster(principal, outletId, departmentId, startDate));
    }

    @GetMapping("/validate-week")
    public ResponseEntity<List<WeeklyValidationDto>> validateWeek(
            @AuthenticationPrincipal EssPrincipal principal,
            @RequestParam(required = false) Long outletId,
            @RequestParam(required = false) Long departmentId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate) {
        return ResponseEntity.ok(scheduleService.validateWeek(principal, outletId, departmentId, startDate));
    }
}
