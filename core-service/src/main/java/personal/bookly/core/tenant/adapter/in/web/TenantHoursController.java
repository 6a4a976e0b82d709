package personal.bookly.core.tenant.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bookly.common.web.ApiResponse;
import personal.bookly.core.tenant.adapter.in.web.dto.TenantHoursResponse;
import personal.bookly.core.tenant.adapter.in.web.dto.UpdateTenantHoursRequest;
import personal.bookly.core.tenant.application.port.in.ManageTenantHoursUseCase;

import java.util.List;

/**
 * Tenant Hours API Controller
 * 테넌트 주간 영업시간 관리
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tenant-hours")
@RequiredArgsConstructor
public class TenantHoursController {

    private final ManageTenantHoursUseCase manageTenantHoursUseCase;

    /**
     * GET /api/v1/tenant-hours?tenant={slug}
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<TenantHoursResponse>>> getHours(@RequestParam("tenant") String tenant) {
        log.info("Get tenant hours: tenant={}", tenant);

        List<TenantHoursResponse> response = manageTenantHoursUseCase.getWeeklyHours(tenant).stream()
                .map(TenantHoursResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Tenant hours", response));
    }

    /**
     * PUT /api/v1/tenant-hours?tenant={slug}
     */
    @PutMapping
    public ResponseEntity<ApiResponse<List<TenantHoursResponse>>> updateHours(
            @RequestParam("tenant") String tenant,
            @Valid @RequestBody UpdateTenantHoursRequest request
    ) {
        log.info("Update tenant hours: tenant={}, days={}", tenant, request.hours().size());

        List<TenantHoursResponse> response = manageTenantHoursUseCase.updateWeeklyHours(request.toCommand(tenant)).stream()
                .map(TenantHoursResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Tenant hours updated", response));
    }
}
