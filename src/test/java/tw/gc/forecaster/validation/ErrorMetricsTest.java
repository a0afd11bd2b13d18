package tw.gc.forecaster.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorMetricsTest {

    private static final double[] ACTUAL = {1, 2, 4};
    private static final double[] PREDICTED = {2, 2, 1};

    @Test
    void testMeanAbsoluteError() {
        assertEquals(4.0 / 3.0, ErrorMetrics.MAE.score(ACTUAL, PREDICTED), 1e-12);
    }

    @Test
    void testSquaredErrors() {
        assertEquals(10.0 / 3.0, ErrorMetrics.MSE.score(ACTUAL, PREDICTED), 1e-12);
        assertEquals(Math.sqrt(10.0 / 3.0), ErrorMetrics.RMSE.score(ACTUAL, PREDICTED), 1e-12);
    }

    @Test
    void testMeanAbsolutePercentageError() {
        assertEquals((1.0 + 0.0 + 0.75) / 3.0, ErrorMetrics.MAPE.score(ACTUAL, PREDICTED), 1e-12);
    }

    @Test
    void testPerfectPrediction() {
        for (ErrorMetrics metric : ErrorMetrics.values()) {
            assertEquals(0.0, metric.score(ACTUAL, ACTUAL.clone()), 1e-12);
        }
    }

    @Test
    void testDefaultAndNames() {
        assertSame(ErrorMetrics.MAE, ErrorMetrics.DEFAULT);
        assertEquals("MAE", ErrorMetrics.MAE.name());
        assertEquals("rmse", ErrorMetrics.RMSE.label());
    }

    @Test
    void testLengthMismatchRejected() {
        assertThrows(IllegalArgumentException.class, () -> ErrorMetrics.MAE.score(ACTUAL, new double[] {1}));
        assertThrows(IllegalArgumentException.class, () -> ErrorMetrics.MSE.score(new double[0], new double[0]));
    }
}
