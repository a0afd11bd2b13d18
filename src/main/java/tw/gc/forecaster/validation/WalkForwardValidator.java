package tw.gc.forecaster.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;
import tw.gc.forecaster.dataset.AlignedDataset;
import tw.gc.forecaster.estimator.MultiOutputForecastEstimator;
import tw.gc.forecaster.exception.InsufficientDataException;
import tw.gc.forecaster.exception.ModelNotFittedException;

/**
 * Walk-forward validation over the aligned rows of a fitted estimator.
 *
 * <pre>
 * rows:   0 ..................................... N-P ........ N-1
 * fold 1:                        [  split  ]      |  holdout   |
 * fold 2:              [     2 x split     ]      |  holdout   |
 * fold 3:    [          3 x split          ]      |  holdout   |
 * </pre>
 *
 * <p>With {@code split = floor(N / (cv + 1))}, fold {@code i} trains a fresh
 * copy of the estimator on the {@code i x split} rows that end right before
 * the last {@code P} (seasonal period) rows. Each fold model predicts the
 * horizon from the most recent aligned feature row, which is compared with
 * that row's actual targets. The estimator passed in is never refitted.
 */
@Slf4j
public class WalkForwardValidator {

    public static final int DEFAULT_FOLDS = 5;

    private final int folds;
    private final ErrorMetric metric;

    public WalkForwardValidator() {
        this(DEFAULT_FOLDS, ErrorMetrics.DEFAULT);
    }

    public WalkForwardValidator(int folds, ErrorMetric metric) {
        if (folds < 1) {
            throw new IllegalArgumentException("folds must be positive, got: " + folds);
        }
        this.folds = folds;
        this.metric = Objects.requireNonNull(metric, "metric");
    }

    public int getFolds() {
        return folds;
    }

    public ErrorMetric getMetric() {
        return metric;
    }

    /**
     * @throws ModelNotFittedException if the estimator has not been fitted
     * @throws InsufficientDataException if the largest fold does not fit before the holdout
     */
    public ValidationReport validate(MultiOutputForecastEstimator estimator) {
        Objects.requireNonNull(estimator, "estimator");
        if (!estimator.isFitted()) {
            throw new ModelNotFittedException("validate");
        }
        AlignedDataset dataset = estimator.getDataset();
        int rows = dataset.rowCount();
        int holdout = estimator.getSeasonalPeriod();
        int split = rows / (folds + 1);

        if (split < 1) {
            throw new InsufficientDataException("Not enough aligned rows for %d folds".formatted(folds), folds + 1, rows);
        }
        int required = folds * split + holdout;
        if (required > rows) {
            throw new InsufficientDataException(
                "Largest fold (%d rows) plus holdout (%d rows) exceeds the aligned rows".formatted(folds * split, holdout),
                required, rows);
        }

        int lastRow = rows - 1;
        double[] evaluationFeatures = dataset.features().row(lastRow);
        double[] actual = dataset.targets().row(lastRow);
        int trainEnd = rows - holdout;

        log.info("🔄 Walk-forward validation: {} folds, split {} rows, holdout {} rows, metric {}",
            folds, split, holdout, metric.name());

        List<ValidationFold> results = new ArrayList<>(folds);
        for (int i = 1; i <= folds; i++) {
            int trainStart = trainEnd - i * split;
            AlignedDataset training = dataset.slice(trainStart, trainEnd);

            MultiOutputForecastEstimator foldEstimator = estimator.newUnfittedCopy().fit(training);
            double[] predicted = foldEstimator.predict(new double[][] {evaluationFeatures})[0];
            double error = metric.score(actual, predicted);

            ValidationFold fold = new ValidationFold(
                i,
                training.rowCount(),
                dataset.features().timestamp(trainStart),
                dataset.features().timestamp(trainEnd - 1),
                dataset.features().timestamp(lastRow),
                error);
            log.info("📊 {}", fold.describe());
            results.add(fold);
        }

        ValidationReport report = new ValidationReport(metric, results);
        log.info("✅ Walk-forward validation complete: mean {} {}", metric.name(), String.format("%.4f", report.meanError()));
        return report;
    }
}
