package personal.bookly.core.availability.adapter.in.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import personal.bookly.core.availability.domain.model.Slot;

/**
 * 슬롯 응답 (time: "HH:MM", label: 12시간제)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SlotResponse(
        String time,
        String label,
        boolean available,
        int capacity,
        int overlaps,
        int blackoutHits
) {
    public static SlotResponse from(Slot slot) {
        return new SlotResponse(
                slot.time(),
                slot.label(),
                slot.available(),
                slot.capacity(),
                slot.overlaps(),
                slot.blackoutHits());
    }
}
