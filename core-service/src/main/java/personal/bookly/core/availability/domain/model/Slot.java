package personal.bookly.core.availability.domain.model;

import personal.bookly.common.time.SlotMath;

/**
 * 슬롯 하나
 *
 * @param startMinute 요청 날짜 자정 기준 분 (자정 이후 슬롯은 1440 이상)
 * @param capacity    동시 수용 가능 수
 * @param overlaps    기준 차원에서 겹치는 예약 수 (여러 차원이면 최대값)
 */
public record Slot(
        int startMinute,
        boolean available,
        int capacity,
        int overlaps,
        int blackoutHits) {

    public String time() {
        return SlotMath.formatClockTime(startMinute);
    }

    public String label() {
        return SlotMath.formatTwelveHour(startMinute);
    }
}
