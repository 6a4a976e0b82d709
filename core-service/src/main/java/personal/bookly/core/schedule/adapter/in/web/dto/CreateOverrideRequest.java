package personal.bookly.core.schedule.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import personal.bookly.core.schedule.application.port.in.CreateOverrideCommand;
import personal.bookly.core.schedule.domain.model.OverrideType;

import java.time.LocalDate;

/**
 * Create Override Request DTO
 * type: OFF | ADD_HOURS | CUSTOM_HOURS
 */
public record CreateOverrideRequest(
        @NotNull(message = "date is required") LocalDate date,
        @NotBlank(message = "type is required") String type,
        Integer startMinute,
        Integer endMinute
) {
    public CreateOverrideCommand toCommand(String tenantSlug, Long staffId) {
        return new CreateOverrideCommand(tenantSlug, staffId, date, OverrideType.from(type), startMinute, endMinute);
    }
}
