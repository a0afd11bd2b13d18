package tw.gc.forecaster.dataset;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import tw.gc.forecaster.series.TimeIndexedTable;

/**
 * Horizon-wide future values, columns {@code t+1 .. t+h}, keyed by the
 * timestamp the forecast is issued from.
 */
public final class TargetTable extends TimeIndexedTable<TargetTable> {

    public TargetTable(List<String> columns, List<LocalDateTime> index, double[][] rows) {
        super(columns, index, rows);
    }

    @Override
    protected TargetTable create(List<String> columns, List<LocalDateTime> index, double[][] rows) {
        return new TargetTable(columns, index, rows);
    }

    public static String columnName(int step) {
        return "t+" + step;
    }

    public static List<String> columnNames(int horizon) {
        List<String> names = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            names.add(columnName(step));
        }
        return names;
    }

    public int horizon() {
        return columnCount();
    }

    public TargetRow targetRow(int row) {
        return new TargetRow(timestamp(row), rowAsMap(row));
    }
}
