package personal.bookly.core.schedule.application.port.in;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.List;

/**
 * Replace Weekly Schedule Command
 * 빈 목록은 주간 일정 전체 삭제를 뜻한다
 */
public record ReplaceWeeklyScheduleCommand(
        String tenantSlug,
        Long staffId,
        List<Block> blocks
) {
    public ReplaceWeeklyScheduleCommand {
        if (tenantSlug == null || tenantSlug.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Tenant cannot be blank");
        }
        if (staffId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID cannot be null");
        }
        if (blocks == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Missing weekly array");
        }
        blocks = List.copyOf(blocks);
    }

    public record Block(int weekday, int startMinute, int endMinute) {
    }
}
