package personal.bookly.common.time;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.util.Optional;

/**
 * Time Window
 * 자정 기준 분 단위 반개구간 [startMinute, endMinute)
 * endMinute는 1440을 넘을 수 있다 (자정을 넘는 영업시간)
 */
public record TimeWindow(int startMinute, int endMinute) {

    public TimeWindow {
        if (startMinute < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Window start cannot be negative: " + startMinute);
        }
        if (endMinute <= startMinute) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Window end must be after start: start=%d, end=%d", startMinute, endMinute));
        }
    }

    public static TimeWindow of(int startMinute, int endMinute) {
        return new TimeWindow(startMinute, endMinute);
    }

    /**
     * 영업시간 정규화
     * close <= open 이면 다음날 close까지로 해석 (예: 18:00 ~ 02:00 -> 1080 ~ 1560)
     */
    public static TimeWindow overnightAware(int openMinute, int closeMinute) {
        int close = closeMinute <= openMinute ? closeMinute + SlotMath.MINUTES_PER_DAY : closeMinute;
        return new TimeWindow(openMinute, close);
    }

    public int length() {
        return endMinute - startMinute;
    }

    public boolean isOvernight() {
        return endMinute > SlotMath.MINUTES_PER_DAY;
    }

    public boolean overlaps(TimeWindow other) {
        return SlotMath.overlaps(startMinute, endMinute, other.startMinute, other.endMinute);
    }

    /**
     * start부터 duration분이 창 안에 온전히 들어가는지
     */
    public boolean fits(int start, int durationMinutes) {
        return start >= startMinute && start + durationMinutes <= endMinute;
    }

    public Optional<TimeWindow> intersect(TimeWindow other) {
        int start = Math.max(startMinute, other.startMinute);
        int end = Math.min(endMinute, other.endMinute);
        if (end <= start) {
            return Optional.empty();
        }
        return Optional.of(new TimeWindow(start, end));
    }
}
