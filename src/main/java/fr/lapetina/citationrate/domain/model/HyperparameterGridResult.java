package fr.lapetina.citationrate.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of one tuning run: the scored (process variance, overdispersion) grid
 * and the maximizing pair. Rows follow the process-variance candidates, columns
 * the overdispersion candidates. Read-only once built.
 *
 * <p>Failed series are keyed by their position in the tuned corpus, so two series
 * sharing an id stay distinct, and are always listed in corpus order.
 */
public final class HyperparameterGridResult {

    private final double[] processVarianceCandidates;
    private final double[] overdispersionCandidates;
    private final double[][] scores;
    private final double bestProcessVariance;
    private final double bestOverdispersion;
    private final double bestLogLikelihood;
    private final int contributingSeries;
    private final SortedMap<Integer, String> failedSeries;

    public HyperparameterGridResult(
            double[] processVarianceCandidates,
            double[] overdispersionCandidates,
            double[][] scores,
            double bestProcessVariance,
            double bestOverdispersion,
            double bestLogLikelihood,
            int contributingSeries,
            Map<Integer, String> failedSeries
    ) {
        Objects.requireNonNull(scores, "Score grid is required");
        if (scores.length != processVarianceCandidates.length) {
            throw new IllegalArgumentException("Score grid rows must match process variance candidates");
        }
        this.processVarianceCandidates = processVarianceCandidates.clone();
        this.overdispersionCandidates = overdispersionCandidates.clone();
        this.scores = new double[scores.length][];
        for (int i = 0; i < scores.length; i++) {
            if (scores[i].length != overdispersionCandidates.length) {
                throw new IllegalArgumentException("Score grid columns must match overdispersion candidates");
            }
            this.scores[i] = scores[i].clone();
        }
        this.bestProcessVariance = bestProcessVariance;
        this.bestOverdispersion = bestOverdispersion;
        this.bestLogLikelihood = bestLogLikelihood;
        this.contributingSeries = contributingSeries;
        SortedMap<Integer, String> failed = new TreeMap<>();
        if (failedSeries != null) {
            failed.putAll(failedSeries);
        }
        this.failedSeries = Collections.unmodifiableSortedMap(failed);
    }

    public double[] getProcessVarianceCandidates() {
        return processVarianceCandidates.clone();
    }

    public double[] getOverdispersionCandidates() {
        return overdispersionCandidates.clone();
    }

    public int getGridSize() {
        return processVarianceCandidates.length;
    }

    public int getEvaluatedCells() {
        return processVarianceCandidates.length * overdispersionCandidates.length;
    }

    public double score(int processVarianceIndex, int overdispersionIndex) {
        return scores[processVarianceIndex][overdispersionIndex];
    }

    public double[][] getScores() {
        double[][] copy = new double[scores.length][];
        for (int i = 0; i < scores.length; i++) {
            copy[i] = scores[i].clone();
        }
        return copy;
    }

    public double getBestProcessVariance() {
        return bestProcessVariance;
    }

    public double getBestOverdispersion() {
        return bestOverdispersion;
    }

    public double getBestLogLikelihood() {
        return bestLogLikelihood;
    }

    public int getContributingSeries() {
        return contributingSeries;
    }

    /**
     * Ids of the series left out of at least one cell, in corpus order.
     */
    public List<String> getFailedSeries() {
        return List.copyOf(failedSeries.values());
    }

    /**
     * Corpus positions of the series left out of at least one cell, ascending.
     */
    public List<Integer> getFailedSeriesIndices() {
        return List.copyOf(failedSeries.keySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HyperparameterGridResult other)) return false;
        return Double.compare(bestProcessVariance, other.bestProcessVariance) == 0
                && Double.compare(bestOverdispersion, other.bestOverdispersion) == 0
                && Double.compare(bestLogLikelihood, other.bestLogLikelihood) == 0
                && contributingSeries == other.contributingSeries
                && Arrays.equals(processVarianceCandidates, other.processVarianceCandidates)
                && Arrays.equals(overdispersionCandidates, other.overdispersionCandidates)
                && Arrays.deepEquals(scores, other.scores)
                && failedSeries.equals(other.failedSeries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bestProcessVariance, bestOverdispersion, bestLogLikelihood, contributingSeries);
    }

    @Override
    public String toString() {
        return "HyperparameterGridResult{" +
                "grid=" + getGridSize() + "x" + overdispersionCandidates.length +
                ", bestProcessVariance=" + bestProcessVariance +
                ", bestOverdispersion=" + bestOverdispersion +
                ", bestLogLikelihood=" + bestLogLikelihood +
                ", contributingSeries=" + contributingSeries +
                '}';
    }
}
