package tw.gc.forecaster.features;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Features of the window ending at {@code timestamp}.
 */
public record FeatureRow(LocalDateTime timestamp, Map<String, Double> features) {

    public FeatureRow {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (features == null) {
            throw new IllegalArgumentException("features cannot be null");
        }
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public double get(String name) {
        Double value = features.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return value;
    }
}
