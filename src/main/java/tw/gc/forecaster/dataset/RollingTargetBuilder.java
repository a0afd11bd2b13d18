package tw.gc.forecaster.dataset;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import tw.gc.forecaster.series.TimeSeries;

/**
 * Builds the multi-step target table: row {@code t} holds
 * {@code values[t + 1 .. t + h]} and exists only when all h future values do,
 * so the final h timestamps of the series never carry a target row.
 */
@Slf4j
public class RollingTargetBuilder {

    private final int horizon;

    public RollingTargetBuilder(int horizon) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be positive, got: " + horizon);
        }
        this.horizon = horizon;
    }

    public int horizon() {
        return horizon;
    }

    public TargetTable build(TimeSeries series) {
        int rowCount = Math.max(0, series.size() - horizon);
        List<LocalDateTime> index = new ArrayList<>(rowCount);
        double[][] rows = new double[rowCount][horizon];
        for (int t = 0; t < rowCount; t++) {
            index.add(series.timestamp(t));
            for (int step = 1; step <= horizon; step++) {
                rows[t][step - 1] = series.value(t + step);
            }
        }
        if (rowCount == 0) {
            log.warn("⚠️ Series of {} observations has no complete {}-step target", series.size(), horizon);
        }
        log.debug("Built {} target rows for horizon {}", rowCount, horizon);
        return new TargetTable(TargetTable.columnNames(horizon), index, rows);
    }
}
