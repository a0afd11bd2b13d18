package tw.gc.forecaster.features;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import tw.gc.forecaster.series.TimeIndexedTable;

/**
 * One row of features per usable window position.
 */
public final class FeatureTable extends TimeIndexedTable<FeatureTable> {

    public FeatureTable(List<String> columns, List<LocalDateTime> index, double[][] rows) {
        super(columns, index, rows);
    }

    @Override
    protected FeatureTable create(List<String> columns, List<LocalDateTime> index, double[][] rows) {
        return new FeatureTable(columns, index, rows);
    }

    public FeatureRow featureRow(int row) {
        return new FeatureRow(timestamp(row), rowAsMap(row));
    }

    public List<FeatureRow> rows() {
        List<FeatureRow> result = new ArrayList<>(rowCount());
        for (int r = 0; r < rowCount(); r++) {
            result.add(featureRow(r));
        }
        return result;
    }
}
