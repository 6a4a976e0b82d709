package personal.bookly.core.availability.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.bookly.core.availability.adapter.in.web.dto.AvailabilityResponse;
import personal.bookly.core.availability.application.port.in.AvailabilityQuery;
import personal.bookly.core.availability.application.port.in.GetAvailabilityUseCase;

import java.time.LocalDate;

/**
 * Availability API Controller
 * 공개 조회 API (인증 헤더 불필요)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final GetAvailabilityUseCase getAvailabilityUseCase;

    /**
     * GET /api/v1/availability?tenant={slug}&service={id}&date=yyyy-MM-dd[&staff={id}][&resource={id}]
     */
    @GetMapping
    public ResponseEntity<AvailabilityResponse> getAvailability(
            @RequestParam("tenant") String tenant,
            @RequestParam("service") Long serviceId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "staff", required = false) Long staffId,
            @RequestParam(value = "resource", required = false) Long resourceId
    ) {
        log.debug("Get availability: tenant={}, serviceId={}, date={}, staffId={}, resourceId={}",
                tenant, serviceId, date, staffId, resourceId);

        AvailabilityQuery query = new AvailabilityQuery(tenant, serviceId, date, staffId, resourceId);
        return ResponseEntity.ok(AvailabilityResponse.from(getAvailabilityUseCase.getAvailability(query)));
    }
}
