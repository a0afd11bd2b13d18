package tw.gc.forecaster.validation;

import java.time.LocalDateTime;

/**
 * One walk-forward fold: a training slice of the aligned rows and the error
 * of the model trained on it.
 *
 * <pre>
 * ┌────────────────────────────────┬─────────────────┐
 * │  Training (i x split rows)     │ Holdout (P rows)│
 * └────────────────────────────────┴─────────────────┘
 *                       trainEnd ──┘        evaluatedAt ──┘
 * </pre>
 *
 * @param foldNumber 1-based fold index; higher folds train on more history
 * @param trainingRows rows in the training slice
 * @param trainStart first training timestamp, inclusive
 * @param trainEnd last training timestamp, inclusive
 * @param evaluatedAt timestamp of the feature row the fold was scored on
 * @param error metric value of the fold
 */
public record ValidationFold(
    int foldNumber,
    int trainingRows,
    LocalDateTime trainStart,
    LocalDateTime trainEnd,
    LocalDateTime evaluatedAt,
    double error
) {
    public ValidationFold {
        if (foldNumber < 1) {
            throw new IllegalArgumentException("foldNumber must be positive, got: %d".formatted(foldNumber));
        }
        if (trainingRows < 1) {
            throw new IllegalArgumentException("trainingRows must be positive, got: %d".formatted(trainingRows));
        }
        if (trainStart == null || trainEnd == null || evaluatedAt == null) {
            throw new IllegalArgumentException("All timestamps must be non-null");
        }
        if (trainStart.isAfter(trainEnd)) {
            throw new IllegalArgumentException("trainStart (%s) must be before or equal to trainEnd (%s)"
                .formatted(trainStart, trainEnd));
        }
        if (!trainEnd.isBefore(evaluatedAt)) {
            throw new IllegalArgumentException("trainEnd (%s) must be before evaluatedAt (%s)"
                .formatted(trainEnd, evaluatedAt));
        }
    }

    public boolean isInTrainPeriod(LocalDateTime timestamp) {
        return !timestamp.isBefore(trainStart) && !timestamp.isAfter(trainEnd);
    }

    public String describe() {
        return "Fold %d: Train [%s → %s] (%d rows) | Evaluated at %s | Error %.4f"
            .formatted(foldNumber, trainStart, trainEnd, trainingRows, evaluatedAt, error);
    }
}
