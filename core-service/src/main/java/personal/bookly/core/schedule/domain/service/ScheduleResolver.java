package personal.bookly.core.schedule.domain.service;

import org.springframework.stereotype.Component;
import personal.bookly.common.time.TimeWindow;
import personal.bookly.core.schedule.domain.model.OverrideType;
import personal.bookly.core.schedule.domain.model.StaffScheduleOverride;
import personal.bookly.core.schedule.domain.model.StaffWeeklyBlock;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Schedule Resolver (Domain Service)
 * 주간 일정과 날짜별 예외를 합쳐 해당 날짜의 근무 블록을 계산
 *
 * <p>우선순위: OFF → 빈 목록, CUSTOM_HOURS → 해당 블록만, 그 외 → 주간 블록 + ADD_HOURS.
 * 결과 블록은 시작 순으로 정렬되고 겹치거나 맞닿은 블록은 병합된다.
 */
@Component
public class ScheduleResolver {

    /**
     * @param weeklyBlocks 해당 요일의 주간 블록
     * @param overrides    해당 날짜의 예외
     */
    public List<TimeWindow> resolve(List<StaffWeeklyBlock> weeklyBlocks, List<StaffScheduleOverride> overrides) {
        if (overrides.stream().anyMatch(o -> o.type() == OverrideType.OFF)) {
            return List.of();
        }

        List<TimeWindow> custom = windowsOf(overrides, OverrideType.CUSTOM_HOURS);
        if (!custom.isEmpty()) {
            return merge(custom);
        }

        List<TimeWindow> blocks = new ArrayList<>();
        weeklyBlocks.forEach(block -> blocks.add(block.window()));
        blocks.addAll(windowsOf(overrides, OverrideType.ADD_HOURS));
        return merge(blocks);
    }

    /**
     * 근무 블록을 영업 창과 교차
     * 자정을 넘는 영업 창이어도 스태프 블록은 같은 날(0..1440) 안으로 잘린다
     */
    public List<TimeWindow> intersectWithOpenWindow(List<TimeWindow> blocks, TimeWindow openWindow) {
        return blocks.stream()
                .map(block -> block.intersect(openWindow))
                .flatMap(Optional::stream)
                .toList();
    }

    private List<TimeWindow> windowsOf(List<StaffScheduleOverride> overrides, OverrideType type) {
        return overrides.stream()
                .filter(o -> o.type() == type)
                .map(StaffScheduleOverride::window)
                .flatMap(Optional::stream)
                .toList();
    }

    private List<TimeWindow> merge(List<TimeWindow> windows) {
        List<TimeWindow> sorted = windows.stream()
                .sorted(Comparator.comparingInt(TimeWindow::startMinute).thenComparingInt(TimeWindow::endMinute))
                .toList();

        List<TimeWindow> merged = new ArrayList<>();
        for (TimeWindow window : sorted) {
            if (merged.isEmpty()) {
                merged.add(window);
                continue;
            }
            TimeWindow last = merged.get(merged.size() - 1);
            if (window.startMinute() <= last.endMinute()) {
                merged.set(merged.size() - 1,
                        TimeWindow.of(last.startMinute(), Math.max(last.endMinute(), window.endMinute())));
            } else {
                merged.add(window);
            }
        }
        return merged;
    }
}
