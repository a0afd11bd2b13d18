package tw.gc.forecaster.estimator;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import lombok.extern.slf4j.Slf4j;
import tw.gc.forecaster.dataset.AlignedDataset;
import tw.gc.forecaster.dataset.AlignmentJoin;
import tw.gc.forecaster.dataset.RollingTargetBuilder;
import tw.gc.forecaster.dataset.TargetTable;
import tw.gc.forecaster.exception.InsufficientDataException;
import tw.gc.forecaster.exception.ModelNotFittedException;
import tw.gc.forecaster.exception.ModelTrainingException;
import tw.gc.forecaster.features.FeatureTable;
import tw.gc.forecaster.features.RollingFeatureBuilder;
import tw.gc.forecaster.regression.Regressor;
import tw.gc.forecaster.regression.TrainedRegressor;
import tw.gc.forecaster.series.Frequency;
import tw.gc.forecaster.series.TimeSeries;

/**
 * Direct multi-step forecaster: one independent regressor per horizon step,
 * all trained on the same rolling feature matrix.
 *
 * <p>Typical use:
 * <pre>
 * var estimator = new MultiOutputForecastEstimator(new RidgeRegressor(), 10, 365, Frequency.DAILY, 4);
 * estimator.fit(series);
 * Forecast next = estimator.forecast();
 * </pre>
 *
 * <p>The estimator is {@link EstimatorState#UNFITTED} until a fit succeeds.
 * Each fit builds a complete new fitted state and swaps it in at once, so a
 * failed fit leaves the previous state untouched and there is never a
 * partially trained model.
 */
@Slf4j
public class MultiOutputForecastEstimator {

    public static final int DEFAULT_HORIZON = 1;
    public static final int DEFAULT_SEASONAL_PERIOD = 12;

    private final Regressor regressor;
    private final int horizon;
    private final int seasonalPeriod;
    private final Frequency frequency;
    private final int workers;

    private volatile FittedState fitted;

    /**
     * Everything a fit produces. {@code rollingFeatures} is the full feature
     * table, including the latest rows that have no target yet.
     */
    private record FittedState(
        FeatureTable rollingFeatures,
        AlignedDataset dataset,
        List<TrainedRegressor> models,
        int lagsToConsider
    ) {
    }

    public MultiOutputForecastEstimator(Regressor regressor) {
        this(regressor, DEFAULT_HORIZON, DEFAULT_SEASONAL_PERIOD, Frequency.DAILY, 1);
    }

    public MultiOutputForecastEstimator(Regressor regressor, int horizon, int seasonalPeriod,
                                        Frequency frequency, int workers) {
        this.regressor = Objects.requireNonNull(regressor, "regressor");
        this.frequency = Objects.requireNonNull(frequency, "frequency");
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be positive, got: " + horizon);
        }
        if (seasonalPeriod < 2) {
            throw new IllegalArgumentException("seasonalPeriod must be >= 2, got: " + seasonalPeriod);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        this.horizon = horizon;
        this.seasonalPeriod = seasonalPeriod;
        this.workers = workers;
    }

    /**
     * Same configuration, no fitted state. Used to retrain on a slice without
     * touching this instance.
     */
    public MultiOutputForecastEstimator newUnfittedCopy() {
        return new MultiOutputForecastEstimator(regressor, horizon, seasonalPeriod, frequency, workers);
    }

    // ========== Fitting ==========

    /**
     * Builds features and targets from the series with the default number of
     * lags, aligns them and fits.
     */
    public MultiOutputForecastEstimator fit(TimeSeries series) {
        return fit(series, RollingFeatureBuilder.DEFAULT_LAGS_TO_CONSIDER);
    }

    /**
     * Builds features and targets from the series, aligns them and fits.
     *
     * @throws InsufficientDataException if the series is shorter than the seasonal period
     * @throws tw.gc.forecaster.exception.AlignmentMismatchException if no row has both features and targets
     */
    public MultiOutputForecastEstimator fit(TimeSeries series, int lagsToConsider) {
        Objects.requireNonNull(series, "series");
        log.info("🔧 Fitting {}-step forecaster on {} observations (seasonal period {}, {} lags, {})",
            horizon, series.size(), seasonalPeriod, lagsToConsider, regressor.name());

        FeatureTable rollingFeatures = new RollingFeatureBuilder(seasonalPeriod, lagsToConsider, workers).build(series);
        TargetTable targets = new RollingTargetBuilder(horizon).build(series);
        AlignedDataset dataset = AlignmentJoin.join(rollingFeatures, targets);

        List<TrainedRegressor> models = trainAll(dataset);
        fitted = new FittedState(rollingFeatures, dataset, models, lagsToConsider);
        log.info("✅ Forecaster fitted on {} aligned rows", dataset.rowCount());
        return this;
    }

    /**
     * Fits on an already aligned dataset. The dataset's feature table doubles
     * as the rolling feature table, so {@link #forecast()} starts after its
     * last row.
     */
    public MultiOutputForecastEstimator fit(AlignedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        if (dataset.horizon() != horizon) {
            throw new IllegalArgumentException("Dataset has %d target columns, estimator horizon is %d"
                .formatted(dataset.horizon(), horizon));
        }
        List<TrainedRegressor> models = trainAll(dataset);
        fitted = new FittedState(dataset.features(), dataset, models, -1);
        log.info("✅ Forecaster fitted on {} aligned rows", dataset.rowCount());
        return this;
    }

    private List<TrainedRegressor> trainAll(AlignedDataset dataset) {
        if (dataset.isEmpty()) {
            throw new InsufficientDataException("No aligned rows to train on", 1, 0);
        }
        double[][] features = dataset.features().toMatrix();
        TargetTable targets = dataset.targets();

        int poolSize = Math.min(workers, horizon);
        if (poolSize == 1) {
            List<TrainedRegressor> models = new ArrayList<>(horizon);
            for (int step = 1; step <= horizon; step++) {
                try {
                    models.add(trainStep(features, targets, step));
                } catch (RuntimeException e) {
                    throw new ModelTrainingException("Training of step %d failed".formatted(step), e);
                }
            }
            return List.copyOf(models);
        }

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<TrainedRegressor>> futures = new ArrayList<>(horizon);
            for (int step = 1; step <= horizon; step++) {
                int current = step;
                futures.add(executor.submit(() -> trainStep(features, targets, current)));
            }
            List<TrainedRegressor> models = new ArrayList<>(horizon);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    models.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    throw new ModelTrainingException("Training of step %d failed".formatted(i + 1), e.getCause());
                }
            }
            return List.copyOf(models);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelTrainingException("Training interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private TrainedRegressor trainStep(double[][] features, TargetTable targets, int step) {
        long start = System.nanoTime();
        TrainedRegressor model = regressor.train(features, targets.column(TargetTable.columnName(step)));
        log.debug("Step {} trained on {} rows in {}ms", step, features.length, (System.nanoTime() - start) / 1_000_000);
        return model;
    }

    // ========== Prediction ==========

    /**
     * Predicts the next {@code horizon} values from the most recent feature row.
     *
     * @throws ModelNotFittedException before a successful fit
     */
    public Forecast forecast() {
        FittedState state = requireFitted("forecast");
        double[] predictions = predict(state, new double[][] {state.rollingFeatures().lastRow()})[0];
        LocalDateTime origin = state.rollingFeatures().lastTimestamp();
        List<LocalDateTime> timestamps = frequency.after(origin, horizon);

        List<Forecast.Point> points = new ArrayList<>(horizon);
        for (int i = 0; i < horizon; i++) {
            points.add(new Forecast.Point(timestamps.get(i), predictions[i]));
        }
        log.info("📈 Forecast {} steps from {}", horizon, origin);
        return new Forecast(points);
    }

    /**
     * Runs every step model on each feature row.
     *
     * @return {@code rows x horizon} predictions
     */
    public double[][] predict(double[][] features) {
        return predict(requireFitted("predict"), features);
    }

    private double[][] predict(FittedState state, double[][] features) {
        double[][] predictions = new double[features.length][horizon];
        for (int step = 0; step < horizon; step++) {
            double[] column = state.models().get(step).predict(features);
            for (int r = 0; r < features.length; r++) {
                predictions[r][step] = column[r];
            }
        }
        return predictions;
    }

    // ========== Getters ==========

    public EstimatorState getState() {
        return fitted == null ? EstimatorState.UNFITTED : EstimatorState.FITTED;
    }

    public boolean isFitted() {
        return getState() == EstimatorState.FITTED;
    }

    public int getHorizon() {
        return horizon;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public int getWorkers() {
        return workers;
    }

    public Regressor getRegressor() {
        return regressor;
    }

    /**
     * The full rolling feature table of the last fit.
     *
     * @throws ModelNotFittedException before a successful fit
     */
    public FeatureTable getRollingFeatures() {
        return requireFitted("getRollingFeatures").rollingFeatures();
    }

    /**
     * The aligned X/y the models were trained on.
     *
     * @throws ModelNotFittedException before a successful fit
     */
    public AlignedDataset getDataset() {
        return requireFitted("getDataset").dataset();
    }

    /**
     * Lags used by the last series fit; -1 when fitted on a prepared dataset.
     */
    public int getLagsToConsider() {
        return requireFitted("getLagsToConsider").lagsToConsider();
    }

    private FittedState requireFitted(String operation) {
        FittedState state = fitted;
        if (state == null) {
            throw new ModelNotFittedException(operation);
        }
        return state;
    }
}
