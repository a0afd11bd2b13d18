package tw.gc.forecaster.features;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import tw.gc.forecaster.SyntheticSeries;
import tw.gc.forecaster.exception.InsufficientDataException;
import tw.gc.forecaster.series.TimeSeries;
import tw.gc.forecaster.stats.StatFeatures;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RollingFeatureBuilder}.
 */
class RollingFeatureBuilderTest {

    private static final int PERIOD = 12;

    @Nested
    @DisplayName("Shape")
    class Shape {

        @ParameterizedTest
        @CsvSource({"200,12,5", "200,12,0", "150,24,3", "60,12,1"})
        @DisplayName("should produce n - P + 1 - k rows")
        void shouldProduceExpectedRowCount(int length, int period, int lags) {
            TimeSeries series = SyntheticSeries.dailySeasonal(length, period, 42L);

            FeatureTable table = new RollingFeatureBuilder(period, lags).build(series);

            assertThat(table.rowCount()).isEqualTo(length - period + 1 - lags);
            assertThat(table.columns()).isEqualTo(FeatureNames.all(period, lags));
        }

        @Test
        @DisplayName("should key rows by the timestamp the window ends at")
        void shouldKeyRowsByWindowEnd() {
            TimeSeries series = SyntheticSeries.dailySeasonal(100, PERIOD, 1L);

            FeatureTable table = new RollingFeatureBuilder(PERIOD, 5).build(series);

            assertThat(table.timestamp(0)).isEqualTo(series.timestamp(PERIOD - 1 + 5));
            assertThat(table.lastTimestamp()).isEqualTo(series.lastTimestamp());
        }

        @Test
        @DisplayName("should add the Hurst exponent only for long seasonal periods")
        void shouldBranchOnHurst() {
            TimeSeries series = SyntheticSeries.dailySeasonal(130, 100, 5L);

            FeatureTable withHurst = new RollingFeatureBuilder(100, 1).build(series);
            FeatureTable withoutHurst = new RollingFeatureBuilder(PERIOD, 1).build(series);

            assertThat(withHurst.hasColumn(FeatureNames.HURST_EXPONENT)).isTrue();
            assertThat(withHurst.rowCount()).isEqualTo(130 - 100 + 1 - 1);
            assertThat(withoutHurst.hasColumn(FeatureNames.HURST_EXPONENT)).isFalse();
        }
    }

    @Nested
    @DisplayName("Values")
    class Values {

        @Test
        @DisplayName("should take lags from before the row and seasonal lags one cycle back")
        void shouldComputeLags() {
            TimeSeries series = SyntheticSeries.dailySeasonal(80, PERIOD, 9L);
            FeatureTable table = new RollingFeatureBuilder(PERIOD, 3).build(series);

            int row = 10;
            int t = PERIOD - 1 + 3 + row;
            FeatureRow features = table.featureRow(row);

            assertThat(features.timestamp()).isEqualTo(series.timestamp(t));
            for (int i = 1; i <= 3; i++) {
                assertThat(features.get(FeatureNames.lag(i))).isEqualTo(series.value(t - i));
                assertThat(features.get(FeatureNames.seasonalLag(i))).isEqualTo(series.value(t - PERIOD - i + 1));
            }
        }

        @Test
        @DisplayName("should compute statistics over the window ending at the row")
        void shouldComputeWindowStatistics() {
            TimeSeries series = SyntheticSeries.dailySeasonal(80, PERIOD, 9L);
            FeatureTable table = new RollingFeatureBuilder(PERIOD, 2).build(series);

            int t = PERIOD - 1 + 2;
            double[] window = series.window(t, PERIOD);
            double mean = Arrays.stream(window).average().orElseThrow();

            assertThat(table.value(0, FeatureNames.MEAN)).isCloseTo(mean, within(1e-12));
            assertThat(table.value(0, FeatureNames.CURVATURE))
                .isCloseTo(StatFeatures.curvature(window), within(1e-12));
        }

        @Test
        @DisplayName("should not depend on values after the row")
        void shouldNotLookAhead() {
            double[] values = SyntheticSeries.seasonalWithNoise(120, PERIOD, 17L);
            double[] altered = values.clone();
            for (int i = 90; i < altered.length; i++) {
                altered[i] += 100.0;
            }

            FeatureTable original = new RollingFeatureBuilder(PERIOD, 5).build(SyntheticSeries.daily(values));
            FeatureTable changed = new RollingFeatureBuilder(PERIOD, 5).build(SyntheticSeries.daily(altered));

            int lastUntouchedRow = 89 - (PERIOD - 1 + 5);
            for (int r = 0; r <= lastUntouchedRow; r++) {
                assertThat(changed.row(r)).containsExactly(original.row(r));
            }
            assertThat(changed.row(lastUntouchedRow + 1)).isNotEqualTo(original.row(lastUntouchedRow + 1));
        }

        @Test
        @DisplayName("should give the same table with several workers")
        void shouldBeDeterministicAcrossWorkers() {
            TimeSeries series = SyntheticSeries.dailySeasonal(400, PERIOD, 23L);

            FeatureTable sequential = new RollingFeatureBuilder(PERIOD, 5, 1).build(series);
            FeatureTable parallel = new RollingFeatureBuilder(PERIOD, 5, 4).build(series);

            assertThat(parallel.index()).isEqualTo(sequential.index());
            for (int r = 0; r < sequential.rowCount(); r++) {
                assertThat(parallel.row(r)).containsExactly(sequential.row(r));
            }
        }
    }

    @Nested
    @DisplayName("Degenerate input")
    class Degenerate {

        @Test
        @DisplayName("should fail for a series shorter than the seasonal period")
        void shouldRejectShortSeries() {
            TimeSeries series = SyntheticSeries.dailySeasonal(10, PERIOD, 1L);

            assertThatThrownBy(() -> new RollingFeatureBuilder(PERIOD, 5).build(series))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("required 12, available 10");
        }

        @Test
        @DisplayName("should return an empty table when lags consume the whole series")
        void shouldReturnEmptyTableWhenNoRowRemains() {
            TimeSeries series = SyntheticSeries.dailySeasonal(14, PERIOD, 1L);

            FeatureTable table = new RollingFeatureBuilder(PERIOD, 5).build(series);

            assertThat(table.isEmpty()).isTrue();
            assertThat(table.columns()).isEqualTo(FeatureNames.all(PERIOD, 5));
        }

        @Test
        @DisplayName("should drop rows with undefined statistics")
        void shouldDropUndefinedRows() {
            double[] values = new double[60];
            for (int i = 40; i < values.length; i++) {
                values[i] = 1.0 + 0.3 * Math.sin(i) + 0.01 * i * i;
            }

            FeatureTable table = new RollingFeatureBuilder(PERIOD, 1).build(SyntheticSeries.daily(values));

            assertThat(table.rowCount()).isLessThan(60 - PERIOD + 1 - 1);
            for (int r = 0; r < table.rowCount(); r++) {
                for (double value : table.row(r)) {
                    assertThat(value).isFinite();
                }
            }
        }

        @Test
        @DisplayName("should reject invalid configuration")
        void shouldRejectInvalidConfiguration() {
            assertThatThrownBy(() -> new RollingFeatureBuilder(1, 5)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new RollingFeatureBuilder(12, -1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new RollingFeatureBuilder(12, 5, 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
