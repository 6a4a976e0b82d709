package personal.bookly.core.tenant.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bookly.common.web.ApiResponse;
import personal.bookly.core.tenant.adapter.in.web.dto.BlackoutResponse;
import personal.bookly.core.tenant.adapter.in.web.dto.CreateBlackoutRequest;
import personal.bookly.core.tenant.application.port.in.ManageBlackoutUseCase;
import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Blackout API Controller
 * 테넌트 차단 구간(휴무, 점검 등) 관리
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/blackouts")
@RequiredArgsConstructor
public class BlackoutController {

    private final ManageBlackoutUseCase manageBlackoutUseCase;

    @PostMapping
    public ResponseEntity<ApiResponse<BlackoutResponse>> create(
            @RequestParam("tenant") String tenant,
            @Valid @RequestBody CreateBlackoutRequest request
    ) {
        log.info("Create blackout: tenant={}, startsAt={}, endsAt={}", tenant, request.startsAt(), request.endsAt());

        Blackout blackout = manageBlackoutUseCase.create(request.toCommand(tenant));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Blackout created", BlackoutResponse.from(blackout)));
    }

    /**
     * GET /api/v1/blackouts?tenant={slug}&from=&to=&includeInactive=
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<BlackoutResponse>>> list(
            @RequestParam("tenant") String tenant,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(value = "includeInactive", defaultValue = "false") boolean includeInactive
    ) {
        log.info("List blackouts: tenant={}, from={}, to={}, includeInactive={}", tenant, from, to, includeInactive);

        List<BlackoutResponse> response = manageBlackoutUseCase
                .list(tenant, from.toInstant(), to.toInstant(), includeInactive).stream()
                .map(BlackoutResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Blackouts", response));
    }

    @DeleteMapping("/{blackoutId}")
    public ResponseEntity<ApiResponse<BlackoutResponse>> deactivate(
            @RequestParam("tenant") String tenant,
            @PathVariable Long blackoutId
    ) {
        log.info("Deactivate blackout: tenant={}, blackoutId={}", tenant, blackoutId);

        Blackout blackout = manageBlackoutUseCase.deactivate(tenant, blackoutId);

        return ResponseEntity.ok(ApiResponse.success("Blackout deactivated", BlackoutResponse.from(blackout)));
    }
}
