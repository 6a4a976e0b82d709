package personal.bookly.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 클라이언트 노출 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "Invalid input."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "Unauthorized."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "Requested resource was not found."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "Resource conflict."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "Internal server error."),
    TRANSIENT_STORE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "C007", "Store is busy. Please retry the request."),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "C008", "Too many requests. Please slow down."),

    // Tenant (Txxx)
    TENANT_NOT_FOUND(HttpStatus.NOT_FOUND, "T001", "Tenant not found."),
    BLACKOUT_NOT_FOUND(HttpStatus.NOT_FOUND, "T002", "Blackout not found."),
    BLACKOUT_OVERLAP(HttpStatus.CONFLICT, "T003", "Blackout overlaps an existing blackout."),

    // Catalog (Sxxx)
    SERVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "Service not found."),
    STAFF_NOT_FOUND(HttpStatus.NOT_FOUND, "S002", "Staff member not found."),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "S003", "Resource not found."),

    // Staff Schedule (Hxxx)
    DUPLICATE_OVERRIDE(HttpStatus.CONFLICT, "H001", "Duplicate schedule override."),
    OVERRIDE_NOT_FOUND(HttpStatus.NOT_FOUND, "H002", "Schedule override not found."),

    // Customer (Uxxx)
    CUSTOMER_NOT_FOUND(HttpStatus.NOT_FOUND, "U001", "Customer not found."),
    PROFILE_INCOMPLETE(HttpStatus.CONFLICT, "U002", "Phone number required before booking."),

    // Booking (Bxxx)
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "Booking not found."),
    BOOKING_IN_PAST(HttpStatus.BAD_REQUEST, "B002", "Cannot create a booking in the past."),
    BOOKING_CONFLICT(HttpStatus.CONFLICT, "B003", "Booking conflicts with an existing booking."),
    BOOKING_BLOCKED(HttpStatus.CONFLICT, "B004", "This time window is blocked."),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT, "B005", "Invalid status transition."),
    BOOKING_ACCESS_DENIED(HttpStatus.FORBIDDEN, "B006", "Booking does not belong to the caller."),

    // Membership (Mxxx)
    NO_ELIGIBLE_ENTITLEMENT(HttpStatus.CONFLICT, "M001", "No eligible membership entitlement found."),
    INSUFFICIENT_MEMBERSHIP_BALANCE(HttpStatus.CONFLICT, "M002", "Insufficient membership balance."),
    MEMBERSHIP_NOT_FOUND(HttpStatus.NOT_FOUND, "M003", "Membership not found."),
    MEMBERSHIP_NOT_USABLE(HttpStatus.BAD_REQUEST, "M004", "Membership is not active."),
    MEMBERSHIP_NOT_OWNED(HttpStatus.BAD_REQUEST, "M005", "Membership does not belong to this customer."),
    MEMBERSHIP_NOT_ALLOWED(HttpStatus.CONFLICT, "M006", "This service does not allow membership use."),
    MEMBERSHIP_PLAN_NOT_FOUND(HttpStatus.NOT_FOUND, "M007", "Plan not found for tenant."),
    MEMBERSHIP_PLAN_INACTIVE(HttpStatus.BAD_REQUEST, "M008", "Plan is not active."),
    BOOKING_ALREADY_DEBITED(HttpStatus.CONFLICT, "M009", "Booking already debited.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
