package personal.bookly.core.booking.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.tenant.domain.model.Blackout;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Booking Blocked Exception
 * 요청 구간이 활성 블랙아웃과 겹칠 때 (409, 본문에 blackout 포함)
 */
public class BookingBlockedException extends BusinessException {
    public BookingBlockedException(Blackout blackout) {
        super(ErrorCode.BOOKING_BLOCKED, ErrorCode.BOOKING_BLOCKED.getMessage(), Map.of("blackout", toView(blackout)));
    }

    private static Map<String, Object> toView(Blackout blackout) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", blackout.id());
        view.put("startsAt", blackout.startsAt());
        view.put("endsAt", blackout.endsAt());
        view.put("reason", blackout.reason());
        view.put("resourceId", blackout.resourceId());
        view.put("staffId", blackout.staffId());
        view.put("serviceId", blackout.serviceId());
        return view;
    }
}
