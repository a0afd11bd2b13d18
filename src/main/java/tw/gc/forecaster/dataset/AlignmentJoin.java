package tw.gc.forecaster.dataset;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;
import tw.gc.forecaster.exception.AlignmentMismatchException;
import tw.gc.forecaster.features.FeatureTable;

/**
 * Restricts a feature table and a target table to the timestamps both hold.
 *
 * <p>Feature rows lose their earliest positions to the warm-up window while
 * target rows lose their latest positions to the horizon; only the overlap
 * has complete inputs and complete outputs.
 */
@Slf4j
public final class AlignmentJoin {

    private AlignmentJoin() {
        throw new AssertionError("Utility class");
    }

    /**
     * @throws AlignmentMismatchException when the two tables share no timestamp
     */
    public static AlignedDataset join(FeatureTable features, TargetTable targets) {
        Set<LocalDateTime> common = new LinkedHashSet<>(features.index());
        common.retainAll(Set.copyOf(targets.index()));
        if (common.isEmpty()) {
            throw new AlignmentMismatchException("Feature table (%d rows) and target table (%d rows) share no timestamp"
                .formatted(features.rowCount(), targets.rowCount()));
        }
        AlignedDataset dataset = new AlignedDataset(features.restrictTo(common), targets.restrictTo(common));
        log.debug("Aligned {} rows from {} feature rows and {} target rows",
            dataset.rowCount(), features.rowCount(), targets.rowCount());
        return dataset;
    }
}
