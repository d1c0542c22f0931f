package fr.lapetina.citationrate.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One paper's yearly counts, aligned on an increasing year axis and transformed
 * into the log-rate observations consumed by the filter.
 *
 * <p>All arrays share one length. Years are the years present in the source
 * mapping; gaps are not filled. Arrays are copied on the way in and out.
 */
public record PreparedSeries(
        String seriesId,
        int[] years,
        double[] counts,
        double[] exposure,
        double[] empiricalRate,
        double[] observations
) {
    public PreparedSeries {
        Objects.requireNonNull(seriesId, "Series id is required");
        int n = years.length;
        if (counts.length != n || exposure.length != n
                || empiricalRate.length != n || observations.length != n) {
            throw new IllegalArgumentException("Series arrays must share one length: " + seriesId);
        }
        years = years.clone();
        counts = counts.clone();
        exposure = exposure.clone();
        empiricalRate = empiricalRate.clone();
        observations = observations.clone();
    }

    public static PreparedSeries empty(String seriesId) {
        return new PreparedSeries(seriesId, new int[0], new double[0], new double[0], new double[0], new double[0]);
    }

    public int length() {
        return years.length;
    }

    public boolean isEmpty() {
        return years.length == 0;
    }

    public int lastYear() {
        if (isEmpty()) {
            throw new IllegalStateException("Empty series has no last year: " + seriesId);
        }
        return years[years.length - 1];
    }

    public double observation(int t) {
        return observations[t];
    }

    @Override
    public int[] years() {
        return years.clone();
    }

    @Override
    public double[] counts() {
        return counts.clone();
    }

    @Override
    public double[] exposure() {
        return exposure.clone();
    }

    @Override
    public double[] empiricalRate() {
        return empiricalRate.clone();
    }

    @Override
    public double[] observations() {
        return observations.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PreparedSeries other)) return false;
        return seriesId.equals(other.seriesId)
                && Arrays.equals(years, other.years)
                && Arrays.equals(counts, other.counts)
                && Arrays.equals(exposure, other.exposure)
                && Arrays.equals(empiricalRate, other.empiricalRate)
                && Arrays.equals(observations, other.observations);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(seriesId);
        result = 31 * result + Arrays.hashCode(years);
        result = 31 * result + Arrays.hashCode(observations);
        return result;
    }

    @Override
    public String toString() {
        return "PreparedSeries{" +
                "seriesId='" + seriesId + '\'' +
                ", years=" + Arrays.toString(years) +
                ", counts=" + Arrays.toString(counts) +
                '}';
    }
}
