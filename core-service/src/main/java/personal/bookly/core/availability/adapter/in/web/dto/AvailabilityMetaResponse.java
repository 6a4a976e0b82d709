package personal.bookly.core.availability.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import personal.bookly.core.availability.domain.model.AvailabilityMeta;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvailabilityMetaResponse(
        int durationMinutes,
        int slotIntervalMinutes,
        int maxParallelBookings,
        String availabilityBasis,
        String reason,
        String scheduleSource
) {
    public static AvailabilityMetaResponse from(AvailabilityMeta meta) {
        return new AvailabilityMetaResponse(
                meta.durationMinutes(),
                meta.slotIntervalMinutes(),
                meta.maxParallelBookings(),
                meta.availabilityBasis().value(),
                meta.reason() == null ? null : meta.reason().value(),
                meta.scheduleSource().value());
    }
}
