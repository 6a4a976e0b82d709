package personal.bookly.core.availability.domain.service;

import org.springframework.stereotype.Component;
import personal.bookly.common.time.SlotMath;
import personal.bookly.common.time.TimeWindow;
import personal.bookly.core.availability.domain.model.Occupancy;
import personal.bookly.core.availability.domain.model.Slot;
import personal.bookly.core.availability.domain.model.SlotGrid;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Slot Calculator (Domain Service)
 * 창 목록과 점유 현황으로 하루치 슬롯을 계산
 *
 * <p>후보 시작 시각은 창마다 ceil(open/step)*step 부터 step 간격, 시작 + 소요시간이 창 끝을 넘지 않는 것만.
 * 후보 구간은 [t, t + duration) 이며 예약 생성의 충돌 판단과 같은 차원 규칙을 따른다.
 */
@Component
public class SlotCalculator {

    public List<Slot> calculate(SlotGrid grid, Occupancy occupancy) {
        int duration = grid.durationMinutes();
        int capacity = Math.max(1, grid.capacity());

        TreeSet<Integer> starts = new TreeSet<>();
        for (TimeWindow window : grid.windows()) {
            SlotMath.slotStarts(window.startMinute(), window.endMinute(), grid.stepMinutes()).stream()
                    .filter(start -> window.fits(start, duration))
                    .forEach(starts::add);
        }

        List<Slot> slots = new ArrayList<>(starts.size());
        for (int start : starts) {
            Instant from = grid.instantAt(start);
            Instant to = grid.instantAt(start + duration);

            int overlaps = overlapsAt(occupancy, from, to);
            int blackoutHits = Occupancy.count(occupancy.blackouts(), from, to);
            boolean available = overlaps < capacity && blackoutHits == 0;

            slots.add(new Slot(start, available, capacity, overlaps, blackoutHits));
        }
        return slots;
    }

    /**
     * 적용되는 차원 중 가장 많이 겹친 수
     * 스태프/리소스가 없을 때만 서비스 차원을 본다
     */
    private int overlapsAt(Occupancy occupancy, Instant from, Instant to) {
        if (occupancy.byStaff() == null && occupancy.byResource() == null) {
            return Occupancy.count(occupancy.byService(), from, to);
        }
        return Math.max(
                Occupancy.count(occupancy.byStaff(), from, to),
                Occupancy.count(occupancy.byResource(), from, to));
    }
}
