package tw.gc.forecaster.dataset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import tw.gc.forecaster.SyntheticSeries;
import tw.gc.forecaster.features.RollingFeatureBuilder;
import tw.gc.forecaster.series.TimeSeries;

import static org.assertj.core.api.Assertions.*;

class TemporalSplitTest {

    private AlignedDataset dataset;

    @BeforeEach
    void setUp() {
        TimeSeries series = SyntheticSeries.dailySeasonal(120, 12, 8L);
        dataset = AlignmentJoin.join(
            new RollingFeatureBuilder(12, 3).build(series),
            new RollingTargetBuilder(2).build(series));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 0.25, 0.33, 0.5, 0.9})
    @DisplayName("should hold out floor(N * t) of the latest rows")
    void shouldHoldOutLatestRows(double testSize) {
        int rows = dataset.rowCount();

        TrainTestSplit split = TemporalSplit.split(dataset, testSize);

        assertThat(split.test().rowCount()).isEqualTo((int) Math.floor(rows * testSize));
        assertThat(split.train().rowCount()).isEqualTo(rows - split.test().rowCount());
        assertThat(split.train().features().columnCount()).isEqualTo(dataset.features().columnCount());
        assertThat(split.test().features().columnCount()).isEqualTo(dataset.features().columnCount());
        assertThat(split.test().index().get(split.test().rowCount() - 1))
            .isEqualTo(dataset.index().get(rows - 1));
        assertThat(split.train().index().get(split.train().rowCount() - 1))
            .isBefore(split.test().index().get(0));
    }

    @Test
    @DisplayName("should reject test sizes outside (0, 1)")
    void shouldRejectInvalidTestSize() {
        assertThatThrownBy(() -> TemporalSplit.split(dataset, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TemporalSplit.split(dataset, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
