package tw.gc.forecaster.stats;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HurstExponentTest {

    @Test
    void windowSizesGrowInQuarterDecades() {
        assertThat(HurstExponent.windowSizes(1000))
            .containsExactly(10, 17, 31, 56, 100, 177, 316, 562, 1000);
    }

    @Test
    void constantSeriesHasNoExponent() {
        assertThat(HurstExponent.estimate(new double[200])).isNaN();
    }

    @Test
    void trendingWalkIsPersistent() {
        double[] trend = new double[500];
        for (int i = 1; i < trend.length; i++) {
            trend[i] = trend[i - 1] + 1.0 + 0.1 * Math.sin(i);
        }
        assertThat(HurstExponent.estimate(trend)).isGreaterThan(0.5);
    }

    @Test
    void rescaledRangeUsesPopulationDeviationOfIncrements() {
        // increments 1, 2, 3: mean 2, population variance 2/3
        double[] series = {0.0, 1.0, 3.0, 6.0};

        assertThat(HurstExponent.rescaledRange(series, 0, 4)).isCloseTo(6.0 / Math.sqrt(2.0 / 3.0), within(1e-12));
    }

    @Test
    void rejectsShortSeries() {
        assertThatThrownBy(() -> HurstExponent.estimate(new double[50]))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
