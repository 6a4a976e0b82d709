package personal.bookly.common.time;

import personal.bookly.common.exception.BusinessException;
import personal.bookly.common.exception.ErrorCode;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slot Math
 * 시각 문자열 <-> 자정 기준 분 변환과 슬롯 그리드 생성 (순수 함수)
 */
public final class SlotMath {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private static final Pattern CLOCK_24H = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");
    private static final Pattern CLOCK_12H = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?m\\.?$");

    private SlotMath() {
    }

    /**
     * "HH:MM", "HH:MM:SS", "h:mm am", "h pm" 형식을 분으로 변환
     * 자정 표기("00:00", "24:00", "12:00 am")는 모두 0
     */
    public static int parseClockTime(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Time value is required");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);

        Matcher twelveHour = CLOCK_12H.matcher(value);
        if (twelveHour.matches()) {
            int hour = Integer.parseInt(twelveHour.group(1));
            int minute = twelveHour.group(2) == null ? 0 : Integer.parseInt(twelveHour.group(2));
            if (hour < 1 || hour > 12 || minute > 59) {
                throw invalidTime(raw);
            }
            boolean pm = "p".equals(twelveHour.group(3));
            int hour24 = hour % 12 + (pm ? 12 : 0);
            return hour24 * 60 + minute;
        }

        Matcher twentyFourHour = CLOCK_24H.matcher(value);
        if (twentyFourHour.matches()) {
            int hour = Integer.parseInt(twentyFourHour.group(1));
            int minute = Integer.parseInt(twentyFourHour.group(2));
            if (hour == 24 && minute == 0) {
                return 0;
            }
            if (hour > 23 || minute > 59) {
                throw invalidTime(raw);
            }
            return hour * 60 + minute;
        }

        throw invalidTime(raw);
    }

    public static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    public static LocalTime toLocalTime(int minuteOfDay) {
        int normalized = Math.floorMod(minuteOfDay, MINUTES_PER_DAY);
        return LocalTime.of(normalized / 60, normalized % 60);
    }

    /**
     * 화면 표시용 "HH:MM" (자정 이후 슬롯은 mod 1440)
     */
    public static String formatClockTime(int minute) {
        int normalized = Math.floorMod(minute, MINUTES_PER_DAY);
        return String.format("%02d:%02d", normalized / 60, normalized % 60);
    }

    /**
     * 12시간제 라벨 (예: 9:00 AM, 12:30 PM)
     */
    public static String formatTwelveHour(int minute) {
        int normalized = Math.floorMod(minute, MINUTES_PER_DAY);
        int hour24 = normalized / 60;
        int hour12 = hour24 % 12 == 0 ? 12 : hour24 % 12;
        String suffix = hour24 < 12 ? "AM" : "PM";
        return String.format("%d:%02d %s", hour12, normalized % 60, suffix);
    }

    /**
     * 슬롯 시작 시각 목록
     * first = ceil(open / step) * step, 이후 step 간격으로 close 미만까지
     * close <= open 인 비정상 설정은 당일 자정까지로 간주
     */
    public static List<Integer> slotStarts(int openMinute, int closeMinute, int stepMinutes) {
        if (stepMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot step must be positive: " + stepMinutes);
        }
        int close = closeMinute <= openMinute ? MINUTES_PER_DAY : closeMinute;

        List<Integer> starts = new ArrayList<>();
        for (int t = ceilToStep(openMinute, stepMinutes); t < close; t += stepMinutes) {
            starts.add(t);
        }
        return starts;
    }

    public static int ceilToStep(int minute, int stepMinutes) {
        return Math.floorDiv(minute + stepMinutes - 1, stepMinutes) * stepMinutes;
    }

    /**
     * 반개구간 겹침 판정, 경계가 맞닿는 경우는 겹치지 않음
     */
    public static boolean overlaps(long aStart, long aEnd, long bStart, long bEnd) {
        return aStart < bEnd && bStart < aEnd;
    }

    private static BusinessException invalidTime(String raw) {
        return new BusinessException(ErrorCode.INVALID_INPUT, "Invalid time value: " + raw);
    }
}
