package personal.bookly.core.booking.domain.exception;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;
import personal.bookly.core.booking.domain.model.OccupiedInterval;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Booking Conflict Exception
 * 같은 스태프/리소스(또는 서비스 용량)와 겹치는 예약이 있을 때
 * 응답 본문에 경쟁 예약 목록(conflicts)을 포함한다
 */
public class BookingConflictException extends BusinessException {

    private final transient List<OccupiedInterval> conflicts;

    public BookingConflictException(List<OccupiedInterval> conflicts) {
        super(ErrorCode.BOOKING_CONFLICT,
                ErrorCode.BOOKING_CONFLICT.getMessage(),
                Map.of("conflicts", conflicts.stream().map(BookingConflictException::toRow).toList()));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<OccupiedInterval> getConflicts() {
        return conflicts;
    }

    private static Map<String, Object> toRow(OccupiedInterval interval) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", interval.bookingId());
        row.put("serviceId", interval.serviceId());
        row.put("staffId", interval.staffId());
        row.put("resourceId", interval.resourceId());
        row.put("startTime", interval.startTime());
        row.put("endTime", interval.endTime());
        row.put("status", interval.status().value());
        return row;
    }
}
