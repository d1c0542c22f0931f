package fr.lapetina.citationrate.domain.model;

import java.util.List;

/**
 * Multi-step forecast for one series. Empty when the horizon is zero.
 */
public record Forecast(List<ForecastStep> steps) {

    public Forecast {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static Forecast empty() {
        return new Forecast(List.of());
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int horizon() {
        return steps.size();
    }

    public List<Integer> years() {
        return steps.stream().map(ForecastStep::year).toList();
    }

    public List<Double> logRateVariances() {
        return steps.stream().map(ForecastStep::logRateVariance).toList();
    }

    public List<Double> rateMedians() {
        return steps.stream().map(ForecastStep::rateMedian).toList();
    }

    public List<Double> rateStds() {
        return steps.stream().map(ForecastStep::rateStd).toList();
    }

    public List<Double> sampledLogRates() {
        return steps.stream().map(ForecastStep::sampledLogRate).toList();
    }

    public List<Double> sampledRates() {
        return steps.stream().map(ForecastStep::sampledRate).toList();
    }
}
