package personal.bookly.core.availability.domain.model;

import personal.bookly.common.time.TimeWindow;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * 슬롯 생성 입력 (하루, 테넌트 시간대 기준)
 *
 * @param windows 예약 가능한 창 목록 (영업시간 또는 스태프 블록)
 */
public record SlotGrid(
        LocalDate date,
        ZoneId zoneId,
        List<TimeWindow> windows,
        int stepMinutes,
        int durationMinutes,
        int capacity) {

    public SlotGrid {
        windows = List.copyOf(windows);
    }

    /**
     * 자정 기준 분 -> Instant (1440 이상은 다음날 벽시계 시각)
     */
    public Instant instantAt(int minute) {
        return date.atStartOfDay().plusMinutes(minute).atZone(zoneId).toInstant();
    }

    public Instant rangeStart() {
        return instantAt(windows.stream().mapToInt(TimeWindow::startMinute).min().orElse(0));
    }

    public Instant rangeEnd() {
        return instantAt(windows.stream().mapToInt(TimeWindow::endMinute).max().orElse(0));
    }
}
