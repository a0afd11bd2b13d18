package tw.gc.forecaster.series;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Row-major numeric table keyed by strictly increasing timestamps.
 *
 * @param <T> concrete table type returned by slicing operations
 */
public abstract class TimeIndexedTable<T extends TimeIndexedTable<T>> {

    private final List<String> columns;
    private final List<LocalDateTime> index;
    private final double[][] rows;
    private final Map<String, Integer> columnPositions;

    protected TimeIndexedTable(List<String> columns, List<LocalDateTime> index, double[][] rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(rows, "rows");
        if (index.size() != rows.length) {
            throw new IllegalArgumentException("index (%d) and rows (%d) must be the same length"
                .formatted(index.size(), rows.length));
        }
        Map<String, Integer> positions = new HashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            if (positions.put(columns.get(c), c) != null) {
                throw new IllegalArgumentException("Duplicate column: " + columns.get(c));
            }
        }
        double[][] copy = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != columns.size()) {
                throw new IllegalArgumentException("Row %d has %d values, expected %d"
                    .formatted(r, rows[r].length, columns.size()));
            }
            if (r > 0 && !index.get(r).isAfter(index.get(r - 1))) {
                throw new IllegalArgumentException("Index must be strictly increasing: %s is not after %s"
                    .formatted(index.get(r), index.get(r - 1)));
            }
            copy[r] = rows[r].clone();
        }
        this.columns = List.copyOf(columns);
        this.index = List.copyOf(index);
        this.rows = copy;
        this.columnPositions = Map.copyOf(positions);
    }

    protected abstract T create(List<String> columns, List<LocalDateTime> index, double[][] rows);

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public List<String> columns() {
        return columns;
    }

    public List<LocalDateTime> index() {
        return index;
    }

    public LocalDateTime timestamp(int row) {
        return index.get(row);
    }

    public LocalDateTime lastTimestamp() {
        if (isEmpty()) {
            throw new IllegalStateException("Table is empty");
        }
        return index.get(index.size() - 1);
    }

    public boolean hasColumn(String name) {
        return columnPositions.containsKey(name);
    }

    public int columnPosition(String name) {
        Integer position = columnPositions.get(name);
        if (position == null) {
            throw new IllegalArgumentException("Unknown column '%s', available: %s".formatted(name, columns));
        }
        return position;
    }

    public double value(int row, String column) {
        return rows[row][columnPosition(column)];
    }

    public double[] row(int row) {
        return rows[row].clone();
    }

    public double[] lastRow() {
        if (isEmpty()) {
            throw new IllegalStateException("Table is empty");
        }
        return row(rows.length - 1);
    }

    public double[] column(String name) {
        int position = columnPosition(name);
        double[] values = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            values[r] = rows[r][position];
        }
        return values;
    }

    /**
     * Copy of the values as a {@code rowCount x columnCount} matrix.
     */
    public double[][] toMatrix() {
        double[][] copy = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            copy[r] = rows[r].clone();
        }
        return copy;
    }

    /**
     * Rows {@code [from, to)} in order.
     */
    public T slice(int from, int to) {
        if (from < 0 || to > rows.length || from > to) {
            throw new IndexOutOfBoundsException("Slice [%d, %d) outside table of %d rows"
                .formatted(from, to, rows.length));
        }
        double[][] selected = new double[to - from][];
        System.arraycopy(rows, from, selected, 0, to - from);
        return create(columns, index.subList(from, to), selected);
    }

    /**
     * The last {@code count} rows.
     */
    public T tail(int count) {
        return slice(Math.max(0, rows.length - count), rows.length);
    }

    /**
     * Rows whose timestamp is in {@code keys}, chronological order preserved.
     */
    public T restrictTo(Set<LocalDateTime> keys) {
        Objects.requireNonNull(keys, "keys");
        List<LocalDateTime> keptIndex = new ArrayList<>();
        List<double[]> keptRows = new ArrayList<>();
        for (int r = 0; r < rows.length; r++) {
            if (keys.contains(index.get(r))) {
                keptIndex.add(index.get(r));
                keptRows.add(rows[r]);
            }
        }
        return create(columns, keptIndex, keptRows.toArray(new double[0][]));
    }

    /**
     * Only the named columns, in the requested order.
     */
    public T select(List<String> names) {
        Objects.requireNonNull(names, "names");
        if (new HashSet<>(names).size() != names.size()) {
            throw new IllegalArgumentException("Duplicate column in selection: " + names);
        }
        int[] positions = names.stream().mapToInt(this::columnPosition).toArray();
        double[][] selected = new double[rows.length][positions.length];
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < positions.length; c++) {
                selected[r][c] = rows[r][positions[c]];
            }
        }
        return create(names, index, selected);
    }

    /**
     * Row {@code row} as column name to value, in column order.
     */
    protected Map<String, Double> rowAsMap(int row) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            values.put(columns.get(c), rows[row][c]);
        }
        return values;
    }

    @Override
    public String toString() {
        return "%s[%d rows x %d columns]".formatted(getClass().getSimpleName(), rowCount(), columnCount());
    }
}
