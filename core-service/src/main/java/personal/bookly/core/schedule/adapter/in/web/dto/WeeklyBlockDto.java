package personal.bookly.core.schedule.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.bookly.core.schedule.application.port.in.ReplaceWeeklyScheduleCommand;
import personal.bookly.core.schedule.domain.model.StaffWeeklyBlock;

/**
 * 주간 근무 블록 DTO (요청/응답 공용)
 */
public record WeeklyBlockDto(
        Long id,
        @NotNull @Min(0) @Max(6) Integer weekday,
        @NotNull @Min(0) @Max(1439) Integer startMinute,
        @NotNull @Min(1) @Max(1440) Integer endMinute
) {
    public static WeeklyBlockDto from(StaffWeeklyBlock block) {
        return new WeeklyBlockDto(block.id(), block.weekday(), block.startMinute(), block.endMinute());
    }

    public ReplaceWeeklyScheduleCommand.Block toBlock() {
        return new ReplaceWeeklyScheduleCommand.Block(weekday, startMinute, endMinute);
    }
}
