package personal.bookly.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Update Booking Status Request DTO
 *
 * @param status pending / confirmed / cancelled (대소문자 무관)
 */
public record UpdateBookingStatusRequest(
        @NotBlank(message = "Invalid status.") String status
) {
}
