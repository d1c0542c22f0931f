package fr.lapetina.citationrate.domain.model;

import java.util.Arrays;

/**
 * Smoothed state mean and variance per time step.
 */
public record SmoothResult(double[] smoothedMean, double[] smoothedVariance) {

    public SmoothResult {
        if (smoothedMean.length != smoothedVariance.length) {
            throw new IllegalArgumentException("Smoothed arrays must share one length");
        }
        smoothedMean = smoothedMean.clone();
        smoothedVariance = smoothedVariance.clone();
    }

    public static SmoothResult empty() {
        return new SmoothResult(new double[0], new double[0]);
    }

    public int length() {
        return smoothedMean.length;
    }

    public boolean isEmpty() {
        return smoothedMean.length == 0;
    }

    public double smoothedMean(int t) {
        return smoothedMean[t];
    }

    public double smoothedVariance(int t) {
        return smoothedVariance[t];
    }

    public double finalMean() {
        return smoothedMean[smoothedMean.length - 1];
    }

    public double finalVariance() {
        return smoothedVariance[smoothedVariance.length - 1];
    }

    @Override
    public double[] smoothedMean() {
        return smoothedMean.clone();
    }

    @Override
    public double[] smoothedVariance() {
        return smoothedVariance.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SmoothResult other)) return false;
        return Arrays.equals(smoothedMean, other.smoothedMean)
                && Arrays.equals(smoothedVariance, other.smoothedVariance);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(smoothedMean) + Arrays.hashCode(smoothedVariance);
    }

    @Override
    public String toString() {
        return "SmoothResult{length=" + length() + '}';
    }
}
