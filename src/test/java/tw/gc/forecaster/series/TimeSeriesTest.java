package tw.gc.forecaster.series;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TimeSeriesTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should build a regular series from a start and a frequency")
        void shouldBuildRegularSeries() {
            TimeSeries series = TimeSeries.of(START, Frequency.WEEKLY, new double[] {1, 2, 3});

            assertThat(series.size()).isEqualTo(3);
            assertThat(series.firstTimestamp()).isEqualTo(START);
            assertThat(series.lastTimestamp()).isEqualTo(START.plusWeeks(2));
            assertThat(series.values()).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("should reject non-increasing timestamps")
        void shouldRejectUnorderedTimestamps() {
            assertThatThrownBy(() -> new TimeSeries(List.of(START, START), new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
        }

        @Test
        @DisplayName("should reject missing values")
        void shouldRejectNaN() {
            assertThatThrownBy(() -> new TimeSeries(List.of(START, START.plusDays(1)), new double[] {1, Double.NaN}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not finite");
        }

        @Test
        @DisplayName("should reject empty and mismatched input")
        void shouldRejectEmptyInput() {
            assertThatThrownBy(() -> new TimeSeries(List.of(), new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new TimeSeries(List.of(START), new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should return the window ending at a position")
    void shouldReturnWindow() {
        TimeSeries series = TimeSeries.of(START, Frequency.DAILY, new double[] {1, 2, 3, 4, 5});

        assertThat(series.window(3, 3)).containsExactly(2, 3, 4);
        assertThatThrownBy(() -> series.window(1, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("should not expose internal state")
    void shouldBeImmutable() {
        double[] values = {1, 2, 3};
        TimeSeries series = TimeSeries.of(START, Frequency.DAILY, values);

        values[0] = 42;
        series.values()[1] = 42;

        assertThat(series.values()).containsExactly(1, 2, 3);
    }
}
