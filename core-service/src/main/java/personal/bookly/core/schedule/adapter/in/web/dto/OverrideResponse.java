package personal.bookly.core.schedule.adapter.in.web.dto;

import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;

import java.time.LocalDate;

public record OverrideResponse(
        Long id,
        LocalDate date,
        String type,
        Integer startMinute,
        Integer endMinute
) {
    public static OverrideResponse from(StaffScheduleOverride override) {
        return new OverrideResponse(
                override.id(),
                override.date(),
                override.type().name(),
                override.startMinute(),
                override.endMinute()
        );
    }
}
