package tw.gc.forecaster.features;

import java.util.ArrayList;
import java.util.List;

/**
 * Column names of the rolling feature table.
 */
public final class FeatureNames {

    public static final String MEAN = "mean";
    public static final String MEDIAN = "median";
    public static final String STD = "std";
    public static final String Q1 = "q1";
    public static final String Q3 = "q3";
    public static final String TREND_STRENGTH = "trend_strength";
    public static final String SEASONAL_STRENGTH = "seasonal_strength";
    public static final String LUMPINESS = "lumpiness";
    public static final String SPIKINESS = "spikiness";
    public static final String CURVATURE = "curvature";
    public static final String HURST_EXPONENT = "hurst_exponent";
    public static final String SPECTRAL_ENTROPY = "spectral_entropy";
    public static final String ADF_PVALUE = "adf_pvalue";

    /** Windows shorter than this do not get a Hurst exponent column */
    public static final int HURST_MIN_SEASONAL_PERIOD = 100;

    private FeatureNames() {
        throw new AssertionError("Utility class");
    }

    public static String lag(int i) {
        return "lag " + i;
    }

    public static String seasonalLag(int i) {
        return "seasonal lag " + i;
    }

    public static boolean includesHurst(int seasonalPeriod) {
        return seasonalPeriod >= HURST_MIN_SEASONAL_PERIOD;
    }

    /**
     * Window statistics, in table order.
     */
    public static List<String> windowStatistics(int seasonalPeriod) {
        List<String> names = new ArrayList<>(List.of(
            MEAN, MEDIAN, STD, Q1, Q3, TREND_STRENGTH, SEASONAL_STRENGTH, LUMPINESS, SPIKINESS, CURVATURE));
        if (includesHurst(seasonalPeriod)) {
            names.add(HURST_EXPONENT);
        }
        names.add(SPECTRAL_ENTROPY);
        names.add(ADF_PVALUE);
        return List.copyOf(names);
    }

    /**
     * Every column: window statistics, then direct and seasonal lags interleaved.
     */
    public static List<String> all(int seasonalPeriod, int lagsToConsider) {
        List<String> names = new ArrayList<>(windowStatistics(seasonalPeriod));
        for (int i = 1; i <= lagsToConsider; i++) {
            names.add(lag(i));
            names.add(seasonalLag(i));
        }
        return List.copyOf(names);
    }
}
