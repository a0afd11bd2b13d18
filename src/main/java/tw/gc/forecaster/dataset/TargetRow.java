package tw.gc.forecaster.dataset;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code t+1 .. t+h} future values seen from {@code timestamp}.
 */
public record TargetRow(LocalDateTime timestamp, Map<String, Double> targets) {

    public TargetRow {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("targets cannot be empty");
        }
        targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    public int horizon() {
        return targets.size();
    }

    /**
     * Value {@code step} observations ahead, 1-based.
     */
    public double step(int step) {
        Double value = targets.get(TargetTable.columnName(step));
        if (value == null) {
            throw new IllegalArgumentException("Step %d outside horizon %d".formatted(step, horizon()));
        }
        return value;
    }
}
