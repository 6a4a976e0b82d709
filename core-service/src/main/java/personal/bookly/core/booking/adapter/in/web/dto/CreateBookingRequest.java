package personal.bookly.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.bookly.core.booking.application.port.in.CreateBookingCommand;
import personal.bookly.core.membership.domain.model.MembershipRequest;

import java.time.OffsetDateTime;

/**
 * Create Booking Request DTO
 * 고객 이메일/이름은 인증 헤더(X-User-Email, X-User-Name)에서 받는다
 */
public record CreateBookingRequest(
        @NotNull(message = "serviceId is required.") Long serviceId,
        Long staffId,
        Long resourceId,
        @NotNull(message = "startTime is required.") OffsetDateTime startTime,
        @Positive(message = "durationMinutes must be positive.") Integer durationMinutes,
        @Size(max = 200) String customerName,
        @Size(max = 50) String customerPhone,
        Long customerMembershipId,
        Boolean autoConsumeMembership,
        Boolean requireMembership
) {
    public CreateBookingCommand toCommand(String tenantSlug, String userEmail, String userName, String idempotencyKey) {
        MembershipRequest membershipRequest = new MembershipRequest(
                customerMembershipId,
                Boolean.TRUE.equals(autoConsumeMembership),
                Boolean.TRUE.equals(requireMembership));

        return new CreateBookingCommand(
                tenantSlug,
                serviceId,
                staffId,
                resourceId,
                startTime.toInstant(),
                durationMinutes,
                userEmail,
                userName != null && !userName.isBlank() ? userName : customerName,
                customerPhone,
                idempotencyKey,
                membershipRequest);
    }
}
