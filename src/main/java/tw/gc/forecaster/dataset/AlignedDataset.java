package tw.gc.forecaster.dataset;

import java.time.LocalDateTime;
import java.util.List;

import tw.gc.forecaster.exception.AlignmentMismatchException;
import tw.gc.forecaster.features.FeatureTable;

/**
 * Features X and targets y sharing the same ordered row keys.
 */
public record AlignedDataset(FeatureTable features, TargetTable targets) {

    public AlignedDataset {
        if (features == null || targets == null) {
            throw new IllegalArgumentException("features and targets are required");
        }
        if (!features.index().equals(targets.index())) {
            throw new AlignmentMismatchException("Feature rows (%d) and target rows (%d) are not keyed identically"
                .formatted(features.rowCount(), targets.rowCount()));
        }
    }

    public int rowCount() {
        return features.rowCount();
    }

    public int horizon() {
        return targets.horizon();
    }

    public List<LocalDateTime> index() {
        return features.index();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    /**
     * Rows {@code [from, to)} of both tables.
     */
    public AlignedDataset slice(int from, int to) {
        return new AlignedDataset(features.slice(from, to), targets.slice(from, to));
    }
}
