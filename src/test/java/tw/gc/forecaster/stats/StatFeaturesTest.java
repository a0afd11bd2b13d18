package tw.gc.forecaster.stats;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tw.gc.forecaster.SyntheticSeries;

import static org.assertj.core.api.Assertions.*;

class StatFeaturesTest {

    private static double[] sine(int length, int period, double amplitude) {
        double[] values = new double[length];
        for (int t = 0; t < length; t++) {
            values[t] = amplitude * Math.sin(2.0 * Math.PI * (t + 1) / period);
        }
        return values;
    }

    private static double[] range(int length) {
        double[] values = new double[length];
        for (int t = 0; t < length; t++) {
            values[t] = t;
        }
        return values;
    }

    @Nested
    @DisplayName("Seasonal strength")
    class SeasonalStrength {

        @Test
        @DisplayName("should be close to 1 for a pure seasonal series")
        void shouldBeHighForSeasonalSeries() {
            assertThat(StatFeatures.seasonalStrength(sine(100, 10, 3.0), 10)).isCloseTo(1.0, within(0.05));
        }

        @Test
        @DisplayName("should be 0 for a constant series")
        void shouldBeZeroForConstantSeries() {
            assertThat(StatFeatures.seasonalStrength(new double[100], 10)).isZero();
        }

        @Test
        @DisplayName("should stay in [0, 1] for noise")
        void shouldBeBoundedForNoise() {
            assertThat(StatFeatures.seasonalStrength(SyntheticSeries.gaussian(100, 1L), 10)).isBetween(0.0, 1.0);
        }

        @Test
        @DisplayName("should be NaN when the window is shorter than the period")
        void shouldBeNaNForShortWindow() {
            assertThat(StatFeatures.seasonalStrength(new double[] {1, 2, 3}, 10)).isNaN();
        }
    }

    @Nested
    @DisplayName("Trend strength")
    class TrendStrength {

        @Test
        @DisplayName("should be close to 1 for a linear trend")
        void shouldBeHighForTrend() {
            assertThat(StatFeatures.trendStrength(range(100), 10)).isCloseTo(1.0, within(0.05));
        }

        @Test
        @DisplayName("should be 0 for a constant series")
        void shouldBeZeroForConstantSeries() {
            assertThat(StatFeatures.trendStrength(new double[100], 10)).isZero();
        }

        @Test
        @DisplayName("should agree with the combined strengths")
        void shouldAgreeWithCombinedComputation() {
            double[] noise = SyntheticSeries.gaussian(100, 2L);
            StatFeatures.Strengths strengths = StatFeatures.strengths(noise, 10);

            assertThat(StatFeatures.trendStrength(noise, 10)).isEqualTo(strengths.trend());
            assertThat(StatFeatures.seasonalStrength(noise, 10)).isEqualTo(strengths.seasonal());
        }
    }

    @Nested
    @DisplayName("Spikiness, lumpiness and curvature")
    class Shape {

        @Test
        @DisplayName("should report no spike for a flat series")
        void shouldReportNoSpike() {
            assertThat(StatFeatures.spikiness(new double[100])).isZero();
        }

        @Test
        @DisplayName("should report two spikes out of a hundred")
        void shouldReportTwoSpikes() {
            double[] values = new double[100];
            values[0] = 10;
            values[1] = 10;
            assertThat(StatFeatures.spikiness(values)).isEqualTo(0.02);
        }

        @Test
        @DisplayName("should keep lumpiness between 0 and the length for a single bump")
        void shouldBoundLumpiness() {
            double[] values = new double[100];
            values[0] = 1;
            assertThat(StatFeatures.lumpiness(values)).isGreaterThan(0.0).isLessThan(100.0);
        }

        @Test
        @DisplayName("should return NaN lumpiness for a zero mean")
        void shouldReturnNaNLumpinessForZeroMean() {
            assertThat(StatFeatures.lumpiness(new double[] {-1, 1})).isNaN();
        }

        @Test
        @DisplayName("should compute the mean second difference")
        void shouldComputeCurvature() {
            assertThat(StatFeatures.curvature(new double[100])).isZero();
            assertThat(StatFeatures.curvature(new double[] {2, 4, 8, 16, 32, 64, 128})).isCloseTo(12.4, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Spectral entropy")
    class SpectralEntropy {

        @Test
        @DisplayName("should be NaN for a constant series")
        void shouldBeNaNForConstantSeries() {
            assertThat(StatFeatures.spectralEntropy(new double[100])).isNaN();
        }

        @Test
        @DisplayName("should be positive for noise")
        void shouldBePositiveForNoise() {
            assertThat(StatFeatures.spectralEntropy(SyntheticSeries.gaussian(100, 3L))).isGreaterThan(0.0);
        }

        @Test
        @DisplayName("should be lower for a clean sine than for noise")
        void shouldBeLowerForSine() {
            double sine = StatFeatures.spectralEntropy(sine(256, 16, 1.0));
            double noise = StatFeatures.spectralEntropy(SyntheticSeries.gaussian(256, 4L));
            assertThat(sine).isLessThan(noise);
        }
    }

    @Nested
    @DisplayName("Hurst exponent")
    class Hurst {

        @Test
        @DisplayName("should be below 0.4 for a mean-reverting walk")
        void shouldDetectMeanReversion() {
            assertThat(StatFeatures.hurstExponent(SyntheticSeries.biasedRandomWalk(10_000, 0.3, 7L))).isLessThan(0.4);
        }

        @Test
        @DisplayName("should be between 0.4 and 0.6 for a random walk")
        void shouldDetectRandomWalk() {
            assertThat(StatFeatures.hurstExponent(SyntheticSeries.biasedRandomWalk(10_000, 0.5, 7L)))
                .isBetween(0.4, 0.6);
        }

        @Test
        @DisplayName("should be above 0.6 for a persistent walk")
        void shouldDetectPersistence() {
            assertThat(StatFeatures.hurstExponent(SyntheticSeries.biasedRandomWalk(10_000, 0.7, 7L)))
                .isGreaterThan(0.6);
        }

        @Test
        @DisplayName("should reject windows shorter than 100 values")
        void shouldRejectShortWindow() {
            assertThatThrownBy(() -> StatFeatures.hurstExponent(new double[99]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("100");
        }
    }

    @Nested
    @DisplayName("Autocorrelation")
    class Correlation {

        @Test
        @DisplayName("should return period + 5 lags within [-1, 1]")
        void shouldReturnBoundedLags() {
            double[] noise = SyntheticSeries.gaussian(100, 5L);

            double[] acf = StatFeatures.autocorrelation(noise, 10);
            double[] pacf = StatFeatures.partialAutocorrelation(noise, 10);

            assertThat(acf).hasSize(15);
            assertThat(pacf).hasSize(15);
            for (int i = 0; i < 15; i++) {
                assertThat(acf[i]).isBetween(-1.0, 1.0);
                assertThat(pacf[i]).isBetween(-1.0, 1.0);
            }
        }

        @Test
        @DisplayName("should stay within bounds for a trend")
        void shouldBeBoundedForTrend() {
            for (double value : StatFeatures.autocorrelation(range(100), 10)) {
                assertThat(value).isBetween(-1.0, 1.0);
            }
            for (double value : StatFeatures.partialAutocorrelation(range(100), 10)) {
                assertThat(value).isBetween(-1.0, 1.0);
            }
        }
    }

    @Nested
    @DisplayName("Unit root")
    class UnitRoot {

        private double[] stationary;
        private double[] explosive;

        @BeforeEach
        void setUp() {
            stationary = SyntheticSeries.autoregressive(100, 0.7, 11L);
            explosive = SyntheticSeries.autoregressive(100, 1.1, 11L);
        }

        @Test
        @DisplayName("should reject the unit root for a stationary AR(1)")
        void shouldRejectUnitRootForStationarySeries() {
            assertThat(StatFeatures.adfPValue(stationary)).isLessThanOrEqualTo(0.05);
        }

        @Test
        @DisplayName("should not reject the unit root for an explosive series")
        void shouldKeepUnitRootForExplosiveSeries() {
            assertThat(StatFeatures.adfPValue(explosive)).isGreaterThanOrEqualTo(0.05);
        }

        @Test
        @DisplayName("should return NaN for a constant series")
        void shouldReturnNaNForConstantSeries() {
            assertThat(StatFeatures.adfPValue(new double[100])).isNaN();
        }
    }
}
