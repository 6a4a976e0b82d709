package personal.bookly.core.schedule.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bookly.common.web.ApiResponse;
import personal.bookly.core.schedule.adapter.in.web.dto.CreateOverrideRequest;
import personal.bookly.core.schedule.adapter.in.web.dto.OverrideResponse;
import personal.bookly.core.schedule.adapter.in.web.dto.ReplaceWeeklyScheduleRequest;
import personal.bookly.core.schedule.adapter.in.web.dto.WeeklyBlockDto;
import personal.bookly.core.schedule.application.port.in.ManageStaffScheduleUseCase;
import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;

import java.time.LocalDate;
import java.util.List;

/**
 * Staff Schedule API Controller
 * 스태프 주간 일정 및 날짜별 예외 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/staff/{staffId}")
@RequiredArgsConstructor
public class StaffScheduleController {

    private final ManageStaffScheduleUseCase manageStaffScheduleUseCase;

    /**
     * 주간 일정 조회
     * GET /api/v1/staff/{staffId}/schedule?tenant={slug}
     */
    @GetMapping("/schedule")
    public ResponseEntity<ApiResponse<List<WeeklyBlockDto>>> getWeekly(
            @PathVariable Long staffId,
            @RequestParam("tenant") String tenant
    ) {
        log.info("Get weekly schedule: tenant={}, staffId={}", tenant, staffId);

        List<WeeklyBlockDto> response = manageStaffScheduleUseCase.getWeekly(tenant, staffId).stream()
                .map(WeeklyBlockDto::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Weekly schedule", response));
    }

    /**
     * 주간 일정 전체 교체
     * PUT /api/v1/staff/{staffId}/schedule?tenant={slug}
     */
    @PutMapping("/schedule")
    public ResponseEntity<ApiResponse<List<WeeklyBlockDto>>> replaceWeekly(
            @PathVariable Long staffId,
            @RequestParam("tenant") String tenant,
            @Valid @RequestBody ReplaceWeeklyScheduleRequest request
    ) {
        log.info("Replace weekly schedule: tenant={}, staffId={}, blocks={}", tenant, staffId, request.weekly().size());

        List<WeeklyBlockDto> response = manageStaffScheduleUseCase.replaceWeekly(request.toCommand(tenant, staffId)).stream()
                .map(WeeklyBlockDto::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Weekly schedule updated", response));
    }

    /**
     * 날짜별 예외 조회
     * GET /api/v1/staff/{staffId}/overrides?tenant={slug}&from=&to=
     */
    @GetMapping("/overrides")
    public ResponseEntity<ApiResponse<List<OverrideResponse>>> listOverrides(
            @PathVariable Long staffId,
            @RequestParam("tenant") String tenant,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        log.info("List overrides: tenant={}, staffId={}, from={}, to={}", tenant, staffId, from, to);

        List<OverrideResponse> response = manageStaffScheduleUseCase.listOverrides(tenant, staffId, from, to).stream()
                .map(OverrideResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Overrides", response));
    }

    @PostMapping("/overrides")
    public ResponseEntity<ApiResponse<OverrideResponse>> createOverride(
            @PathVariable Long staffId,
            @RequestParam("tenant") String tenant,
            @Valid @RequestBody CreateOverrideRequest request
    ) {
        log.info("Create override: tenant={}, staffId={}, date={}, type={}", tenant, staffId, request.date(), request.type());

        StaffScheduleOverride override = manageStaffScheduleUseCase.createOverride(request.toCommand(tenant, staffId));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Override created", OverrideResponse.from(override)));
    }

    @DeleteMapping("/overrides/{overrideId}")
    public ResponseEntity<ApiResponse<Void>> deleteOverride(
            @PathVariable Long staffId,
            @PathVariable Long overrideId,
            @RequestParam("tenant") String tenant
    ) {
        log.info("Delete override: tenant={}, staffId={}, overrideId={}", tenant, staffId, overrideId);

        manageStaffScheduleUseCase.deleteOverride(tenant, staffId, overrideId);

        return ResponseEntity.ok(ApiResponse.success("Override deleted"));
    }
}
