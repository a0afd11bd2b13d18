package tw.gc.forecaster.stats;

import java.util.Objects;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Welch power spectral density estimate: Hann-windowed segments of up to 256
 * points with 50% overlap, each segment mean-removed, one-sided periodograms
 * averaged. Sampling frequency is 1.
 */
public final class SpectralDensity {

    public static final int DEFAULT_SEGMENT_LENGTH = 256;

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private SpectralDensity() {
        throw new AssertionError("Utility class");
    }

    /**
     * One-sided density at the {@code segment / 2 + 1} non-negative frequencies.
     */
    public static double[] welch(double[] x) {
        Objects.requireNonNull(x, "x");
        if (x.length < 2) {
            throw new IllegalArgumentException("Welch estimate needs at least 2 values, got: " + x.length);
        }
        int segmentLength = Math.min(DEFAULT_SEGMENT_LENGTH, x.length);
        int overlap = segmentLength / 2;
        int step = segmentLength - overlap;
        int segments = (x.length - overlap) / step;

        double[] window = hann(segmentLength);
        double windowPower = 0.0;
        for (double w : window) {
            windowPower += w * w;
        }

        int bins = segmentLength / 2 + 1;
        double[] density = new double[bins];
        double[] segment = new double[segmentLength];
        for (int s = 0; s < segments; s++) {
            int offset = s * step;
            double mean = 0.0;
            for (int i = 0; i < segmentLength; i++) {
                mean += x[offset + i];
            }
            mean /= segmentLength;
            for (int i = 0; i < segmentLength; i++) {
                segment[i] = (x[offset + i] - mean) * window[i];
            }
            double[] power = powerSpectrum(segment, bins);
            for (int k = 0; k < bins; k++) {
                density[k] += power[k];
            }
        }

        for (int k = 0; k < bins; k++) {
            double value = density[k] / (segments * windowPower);
            boolean nyquist = segmentLength % 2 == 0 && k == bins - 1;
            if (k != 0 && !nyquist) {
                value *= 2.0;
            }
            density[k] = value;
        }
        return density;
    }

    /**
     * Periodic Hann window.
     */
    static double[] hann(int length) {
        double[] window = new double[length];
        for (int i = 0; i < length; i++) {
            window[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / length);
        }
        return window;
    }

    private static double[] powerSpectrum(double[] segment, int bins) {
        double[] power = new double[bins];
        if (ArithmeticUtils.isPowerOfTwo(segment.length)) {
            Complex[] transformed = FFT.transform(segment, TransformType.FORWARD);
            for (int k = 0; k < bins; k++) {
                double abs = transformed[k].abs();
                power[k] = abs * abs;
            }
            return power;
        }
        int n = segment.length;
        for (int k = 0; k < bins; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int t = 0; t < n; t++) {
                double angle = 2.0 * Math.PI * k * t / n;
                re += segment[t] * Math.cos(angle);
                im -= segment[t] * Math.sin(angle);
            }
            power[k] = re * re + im * im;
        }
        return power;
    }
}
