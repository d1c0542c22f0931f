package fr.lapetina.citationrate.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Analysis result for one paper: the prepared series, its smoothed trajectory,
 * an optional forecast, and any consistency warnings raised along the way.
 * Immutable and thread-safe.
 */
public record PaperAnalysis(
        int index,
        String title,
        PreparedSeries series,
        SmoothResult smoothed,
        Forecast forecast,
        List<String> warnings
) {
    public PaperAnalysis {
        Objects.requireNonNull(title, "Title is required");
        Objects.requireNonNull(series, "Series is required");
        Objects.requireNonNull(smoothed, "Smoothed state is required");
        if (smoothed.length() != series.length()) {
            throw new IllegalArgumentException("Smoothed state does not cover the series: " + title);
        }
        forecast = forecast != null ? forecast : Forecast.empty();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Creates the all-empty result for a paper without any yearly citations.
     */
    public static PaperAnalysis empty(int index, String title, List<String> warnings) {
        return new PaperAnalysis(index, title, PreparedSeries.empty(title), SmoothResult.empty(),
                Forecast.empty(), warnings);
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    public boolean hasForecast() {
        return !forecast.isEmpty();
    }

    public double[] smoothedLogRate() {
        return smoothed.smoothedMean();
    }

    public double[] smoothedRate() {
        double[] mean = smoothed.smoothedMean();
        double[] rate = new double[mean.length];
        for (int t = 0; t < mean.length; t++) {
            rate[t] = Math.exp(mean[t]);
        }
        return rate;
    }

    /**
     * Rate-space standard deviation by the delta method: {@code exp(x) * sqrt(P)}.
     */
    public double[] smoothedRateStd() {
        double[] rate = smoothedRate();
        double[] std = new double[rate.length];
        for (int t = 0; t < rate.length; t++) {
            std[t] = rate[t] * Math.sqrt(smoothed.smoothedVariance(t));
        }
        return std;
    }

    public double observedTotal() {
        double total = 0.0;
        for (double count : series.counts()) {
            total += count;
        }
        return total;
    }
}
