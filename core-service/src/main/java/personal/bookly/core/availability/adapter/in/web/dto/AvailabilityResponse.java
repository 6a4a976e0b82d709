package personal.bookly.core.availability.adapter.in.web.dto;

import personal.bookly.core.availability.domain.model.DayAvailability;

import java.util.List;

/**
 * Availability Response DTO
 */
public record AvailabilityResponse(
        List<SlotResponse> slots,
        AvailabilityMetaResponse meta
) {
    public static AvailabilityResponse from(DayAvailability availability) {
        return new AvailabilityResponse(
                availability.slots().stream().map(SlotResponse::from).toList(),
                AvailabilityMetaResponse.from(availability.meta()));
    }
}
