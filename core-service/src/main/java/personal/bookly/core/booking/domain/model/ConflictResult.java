package personal.bookly.core.booking.domain.model;

import java.util.List;

/**
 * Conflict check result
 *
 * @param conflict 용량 초과 여부
 * @param rows     경쟁 예약 (시작 순, 최대 20건)
 */
public record ConflictResult(boolean conflict, List<OccupiedInterval> rows) {

    public ConflictResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static ConflictResult none() {
        return new ConflictResult(false, List.of());
    }
}
