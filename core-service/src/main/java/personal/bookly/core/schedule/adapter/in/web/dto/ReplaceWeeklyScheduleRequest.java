package personal.bookly.core.schedule.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import personal.bookly.core.schedule.application.port.in.ReplaceWeeklyScheduleCommand;

import java.util.List;

public record ReplaceWeeklyScheduleRequest(
        @NotNull(message = "weekly is required") List<@Valid WeeklyBlockDto> weekly
) {
    public ReplaceWeeklyScheduleCommand toCommand(String tenantSlug, Long staffId) {
        return new ReplaceWeeklyScheduleCommand(tenantSlug, staffId,
                weekly.stream().map(WeeklyBlockDto::toBlock).toList());
    }
}
