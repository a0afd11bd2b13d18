package tw.gc.forecaster.features;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.DoubleSupplier;

import lombok.extern.slf4j.Slf4j;
import tw.gc.forecaster.exception.ForecasterException;
import tw.gc.forecaster.exception.InsufficientDataException;
import tw.gc.forecaster.series.TimeSeries;
import tw.gc.forecaster.stats.DescriptiveStats;
import tw.gc.forecaster.stats.StatFeatures;

/**
 * Slides a window of {@code seasonalPeriod} values over a series and turns
 * every position into a {@link FeatureRow}.
 *
 * <p>Row {@code t} holds the window statistics of {@code values[t - P + 1 .. t]},
 * the direct lags {@code lag i = values[t - i]} and the seasonal lags
 * {@code seasonal lag i = values[t - P - i + 1]} for {@code i = 1..k}. The first
 * {@code P - 1 + k} positions lack history and are never emitted; rows whose
 * statistics are not finite are dropped as well. Nothing in row {@code t}
 * depends on a value after {@code t}.
 *
 * <p>Window statistics are independent per position and may be computed by
 * several workers; each worker fills a disjoint block of positions and the
 * table is assembled in chronological order afterwards.
 */
@Slf4j
public class RollingFeatureBuilder {

    public static final int DEFAULT_LAGS_TO_CONSIDER = 5;

    /** Positions handed to a worker at once */
    private static final int CHUNK_SIZE = 64;

    private final int seasonalPeriod;
    private final int lagsToConsider;
    private final int workers;

    public RollingFeatureBuilder(int seasonalPeriod, int lagsToConsider) {
        this(seasonalPeriod, lagsToConsider, 1);
    }

    public RollingFeatureBuilder(int seasonalPeriod, int lagsToConsider, int workers) {
        if (seasonalPeriod < 2) {
            throw new IllegalArgumentException("seasonalPeriod must be >= 2, got: " + seasonalPeriod);
        }
        if (lagsToConsider < 0) {
            throw new IllegalArgumentException("lagsToConsider must be non-negative, got: " + lagsToConsider);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        this.seasonalPeriod = seasonalPeriod;
        this.lagsToConsider = lagsToConsider;
        this.workers = workers;
    }

    public int seasonalPeriod() {
        return seasonalPeriod;
    }

    public int lagsToConsider() {
        return lagsToConsider;
    }

    /**
     * Number of leading positions without a complete window and lag history.
     */
    public int warmUpRows() {
        return seasonalPeriod - 1 + lagsToConsider;
    }

    public List<String> columns() {
        return FeatureNames.all(seasonalPeriod, lagsToConsider);
    }

    /**
     * Builds the feature table of {@code series}.
     *
     * @throws InsufficientDataException if the series is shorter than one window
     */
    public FeatureTable build(TimeSeries series) {
        int n = series.size();
        if (n < seasonalPeriod) {
            throw new InsufficientDataException("Series is shorter than the seasonal period", seasonalPeriod, n);
        }

        boolean withHurst = FeatureNames.includesHurst(seasonalPeriod);
        if (!withHurst) {
            log.debug("Seasonal period {} < {}: hurst_exponent omitted", seasonalPeriod,
                FeatureNames.HURST_MIN_SEASONAL_PERIOD);
        }

        List<String> columns = columns();
        int firstRow = warmUpRows();
        if (firstRow >= n) {
            log.warn("⚠️ No feature row available: {} observations, {} needed before the first row", n, firstRow + 1);
            return new FeatureTable(columns, List.of(), new double[0][]);
        }

        double[][] statistics = computeWindowStatistics(series, firstRow, withHurst);
        int statisticCount = statistics[0].length;

        List<LocalDateTime> index = new ArrayList<>(n - firstRow);
        List<double[]> rows = new ArrayList<>(n - firstRow);
        int dropped = 0;
        for (int t = firstRow; t < n; t++) {
            double[] row = new double[columns.size()];
            System.arraycopy(statistics[t - firstRow], 0, row, 0, statisticCount);
            int position = statisticCount;
            for (int i = 1; i <= lagsToConsider; i++) {
                row[position++] = series.value(t - i);
                row[position++] = series.value(t - seasonalPeriod - i + 1);
            }
            if (allFinite(row)) {
                index.add(series.timestamp(t));
                rows.add(row);
            } else {
                dropped++;
            }
        }

        if (dropped > 0) {
            log.warn("⚠️ Dropped {} feature rows with undefined statistics", dropped);
        }
        log.info("📊 Built {} feature rows x {} columns (window {}, {} lags, {} warm-up rows)",
            rows.size(), columns.size(), seasonalPeriod, lagsToConsider, firstRow);
        return new FeatureTable(columns, index, rows.toArray(new double[0][]));
    }

    /**
     * Window statistics for every position from {@code firstRow} to the end.
     */
    private double[][] computeWindowStatistics(TimeSeries series, int firstRow, boolean withHurst) {
        int positions = series.size() - firstRow;
        double[][] statistics = new double[positions][];
        if (workers == 1 || positions <= CHUNK_SIZE) {
            fill(statistics, series, firstRow, 0, positions, withHurst);
            return statistics;
        }

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int start = 0; start < positions; start += CHUNK_SIZE) {
                int from = start;
                int to = Math.min(positions, start + CHUNK_SIZE);
                futures.add(executor.submit(() -> fill(statistics, series, firstRow, from, to, withHurst)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForecasterException("Feature computation interrupted", e);
        } catch (ExecutionException e) {
            throw new ForecasterException("Feature computation failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
        return statistics;
    }

    private void fill(double[][] statistics, TimeSeries series, int firstRow, int from, int to, boolean withHurst) {
        for (int slot = from; slot < to; slot++) {
            double[] window = series.window(firstRow + slot, seasonalPeriod);
            statistics[slot] = windowStatistics(window, withHurst);
        }
    }

    /**
     * Statistics of one window, in {@link FeatureNames#windowStatistics(int)} order.
     */
    double[] windowStatistics(double[] window, boolean withHurst) {
        StatFeatures.Strengths strengths = computeStrengths(window);
        List<Double> values = new ArrayList<>(13);
        values.add(DescriptiveStats.mean(window));
        values.add(DescriptiveStats.median(window));
        values.add(DescriptiveStats.standardDeviation(window));
        values.add(DescriptiveStats.quantile(window, 0.25));
        values.add(DescriptiveStats.quantile(window, 0.75));
        values.add(strengths.trend());
        values.add(strengths.seasonal());
        values.add(safely("lumpiness", () -> StatFeatures.lumpiness(window)));
        values.add(safely("spikiness", () -> StatFeatures.spikiness(window)));
        values.add(safely("curvature", () -> StatFeatures.curvature(window)));
        if (withHurst) {
            values.add(safely("hurst_exponent", () -> StatFeatures.hurstExponent(window)));
        }
        values.add(safely("spectral_entropy", () -> StatFeatures.spectralEntropy(window)));
        values.add(safely("adf_pvalue", () -> StatFeatures.adfPValue(window)));
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private StatFeatures.Strengths computeStrengths(double[] window) {
        try {
            return StatFeatures.strengths(window, seasonalPeriod);
        } catch (RuntimeException e) {
            log.debug("Decomposition failed, strengths set to NaN: {}", e.getMessage());
            return new StatFeatures.Strengths(Double.NaN, Double.NaN);
        }
    }

    private static double safely(String feature, DoubleSupplier computation) {
        try {
            return computation.getAsDouble();
        } catch (RuntimeException e) {
            log.debug("{} failed, set to NaN: {}", feature, e.getMessage());
            return Double.NaN;
        }
    }

    private static boolean allFinite(double[] row) {
        for (double v : row) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
