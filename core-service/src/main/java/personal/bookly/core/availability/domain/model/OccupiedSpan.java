package personal.bookly.core.availability.domain.model;

import personal.bookly.common.time.SlotMath;

import java.time.Instant;

/**
 * 시간을 점유하는 구간 (예약 또는 블랙아웃), [start, end)
 */
public record OccupiedSpan(Instant start, Instant end) {

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return SlotMath.overlaps(start.toEpochMilli(), end.toEpochMilli(),
                otherStart.toEpochMilli(), otherEnd.toEpochMilli());
    }
}
