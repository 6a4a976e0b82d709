package personal.bookly.common.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import personal.bookly.common.exception.BusinessException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SlotMath 단위 테스트")
class SlotMathTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "09:00, 540",
            "9:30, 570",
            "17:45:00, 1065",
            "00:00, 0",
            "24:00, 0",
            "12:00 am, 0",
            "12 pm, 720",
            "9:15 p.m., 1275",
            "1 AM, 60"
    })
    @DisplayName("다양한 시각 표기를 분으로 변환한다")
    void parseClockTime(String raw, int expected) {
        assertThat(SlotMath.parseClockTime(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"25:00", "10:75", "13 pm", "noon", " "})
    @DisplayName("잘못된 시각 표기는 INVALID_INPUT")
    void parseClockTime_Invalid(String raw) {
        assertThatThrownBy(() -> SlotMath.parseClockTime(raw))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("자정 이후 분은 mod 1440 으로 표시한다")
    void formatClockTime_WrapsAfterMidnight() {
        assertThat(SlotMath.formatClockTime(540)).isEqualTo("09:00");
        assertThat(SlotMath.formatClockTime(1500)).isEqualTo("01:00");
        assertThat(SlotMath.formatTwelveHour(0)).isEqualTo("12:00 AM");
        assertThat(SlotMath.formatTwelveHour(750)).isEqualTo("12:30 PM");
        assertThat(SlotMath.formatTwelveHour(1500)).isEqualTo("1:00 AM");
    }

    @Test
    @DisplayName("첫 슬롯은 간격 배수로 올림한다")
    void slotStarts_CeilsToStep() {
        assertThat(SlotMath.slotStarts(545, 660, 30)).containsExactly(570, 600, 630);
        assertThat(SlotMath.slotStarts(540, 660, 60)).containsExactly(540, 600);
    }

    @Test
    @DisplayName("자정을 넘는 창도 끝까지 생성한다")
    void slotStarts_Overnight() {
        assertThat(SlotMath.slotStarts(1320, 1560, 60)).containsExactly(1320, 1380, 1440, 1500);
    }

    @Test
    @DisplayName("간격이 0 이하이면 예외")
    void slotStarts_InvalidStep() {
        assertThatThrownBy(() -> SlotMath.slotStarts(540, 600, 0))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Slot step must be positive");
    }

    @Test
    @DisplayName("맞닿은 구간은 겹치지 않는다")
    void overlaps_HalfOpen() {
        assertThat(SlotMath.overlaps(0, 60, 60, 120)).isFalse();
        assertThat(SlotMath.overlaps(0, 61, 60, 120)).isTrue();
        assertThat(SlotMath.overlaps(30, 40, 0, 120)).isTrue();
    }
}
