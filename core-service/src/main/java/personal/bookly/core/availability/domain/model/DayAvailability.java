package personal.bookly.core.availability.domain.model;

import java.util.List;

/**
 * 하루치 슬롯 + 메타
 */
public record DayAvailability(List<Slot> slots, AvailabilityMeta meta) {

    public DayAvailability {
        slots = List.copyOf(slots);
    }

    public static DayAvailability empty(AvailabilityMeta meta) {
        return new DayAvailability(List.of(), meta);
    }
}
