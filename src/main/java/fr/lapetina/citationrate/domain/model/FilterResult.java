package fr.lapetina.citationrate.domain.model;

import java.util.Arrays;

/**
 * Output of one forward filter pass: predicted and filtered state per time step,
 * plus the series' summed log-likelihood.
 *
 * <p>Stored as flat arrays indexed by time. Immutable once built.
 */
public record FilterResult(
        double[] predictedMean,
        double[] predictedVariance,
        double[] filteredMean,
        double[] filteredVariance,
        double logLikelihood
) {
    public FilterResult {
        int n = predictedMean.length;
        if (predictedVariance.length != n || filteredMean.length != n || filteredVariance.length != n) {
            throw new IllegalArgumentException("Filter arrays must share one length");
        }
        predictedMean = predictedMean.clone();
        predictedVariance = predictedVariance.clone();
        filteredMean = filteredMean.clone();
        filteredVariance = filteredVariance.clone();
    }

    public static FilterResult empty() {
        return new FilterResult(new double[0], new double[0], new double[0], new double[0], 0.0);
    }

    public int length() {
        return predictedMean.length;
    }

    public double predictedMean(int t) {
        return predictedMean[t];
    }

    public double predictedVariance(int t) {
        return predictedVariance[t];
    }

    public double filteredMean(int t) {
        return filteredMean[t];
    }

    public double filteredVariance(int t) {
        return filteredVariance[t];
    }

    @Override
    public double[] predictedMean() {
        return predictedMean.clone();
    }

    @Override
    public double[] predictedVariance() {
        return predictedVariance.clone();
    }

    @Override
    public double[] filteredMean() {
        return filteredMean.clone();
    }

    @Override
    public double[] filteredVariance() {
        return filteredVariance.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterResult other)) return false;
        return Double.compare(logLikelihood, other.logLikelihood) == 0
                && Arrays.equals(predictedMean, other.predictedMean)
                && Arrays.equals(predictedVariance, other.predictedVariance)
                && Arrays.equals(filteredMean, other.filteredMean)
                && Arrays.equals(filteredVariance, other.filteredVariance);
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(logLikelihood);
        result = 31 * result + Arrays.hashCode(filteredMean);
        result = 31 * result + Arrays.hashCode(filteredVariance);
        return result;
    }

    @Override
    public String toString() {
        return "FilterResult{length=" + length() + ", logLikelihood=" + logLikelihood + '}';
    }
}
