package fr.lapetina.citationrate.pipeline;

import fr.lapetina.citationrate.domain.model.Forecast;
import fr.lapetina.citationrate.domain.model.ForecastStep;
import fr.lapetina.citationrate.domain.model.HIndexPoint;
import fr.lapetina.citationrate.domain.model.PaperAnalysis;
import fr.lapetina.citationrate.domain.model.PreparedSeries;
import fr.lapetina.citationrate.domain.model.SmoothResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HIndexProjectorTest {

    private final HIndexProjector projector = new HIndexProjector();

    /**
     * Builds an analysed paper whose smoothed rates are exactly {@code rates}.
     */
    private static PaperAnalysis paper(int index, int firstYear, double[] rates, double... forecastMedians) {
        int n = rates.length;
        int[] years = new int[n];
        double[] logRates = new double[n];
        for (int t = 0; t < n; t++) {
            years[t] = firstYear + t;
            logRates[t] = Math.log(rates[t]);
        }
        PreparedSeries series = new PreparedSeries("p" + index, years, rates.clone(), new double[n], rates.clone(),
                logRates);
        SmoothResult smoothed = new SmoothResult(logRates, new double[n]);

        List<ForecastStep> steps = new ArrayList<>();
        for (int h = 0; h < forecastMedians.length; h++) {
            steps.add(new ForecastStep(h + 1, years[n - 1] + h + 1, 0.1, forecastMedians[h], 1.0, 0.0, 1.0));
        }
        return new PaperAnalysis(index, "p" + index, series, smoothed, new Forecast(steps), List.of());
    }

    @Test
    @DisplayName("should compute the h-index of accumulated citations")
    void shouldComputeHIndex() {
        assertThat(HIndexProjector.hIndex(new double[]{10, 8, 5, 4, 3})).isEqualTo(4);
        assertThat(HIndexProjector.hIndex(new double[]{25, 8, 5, 3, 3})).isEqualTo(3);
        assertThat(HIndexProjector.hIndex(new double[]{0.4, 0.2})).isZero();
        assertThat(HIndexProjector.hIndex(new double[0])).isZero();
    }

    @Test
    @DisplayName("should accumulate yearly rates over the timeline")
    void shouldAccumulateOverTimeline() {
        List<PaperAnalysis> papers = List.of(
                paper(0, 2020, new double[]{1.5, 2.5, 3.5}),
                paper(1, 2021, new double[]{2.5, 2.5}),
                paper(2, 2022, new double[]{4.5}));

        List<HIndexPoint> points = projector.project(papers);

        assertThat(points).containsExactly(
                new HIndexPoint(2020, 1, false),
                new HIndexPoint(2021, 2, false),
                new HIndexPoint(2022, 3, false));
    }

    @Test
    @DisplayName("should extend the timeline with forecast medians")
    void shouldExtendWithForecast() {
        List<PaperAnalysis> papers = List.of(
                paper(0, 2022, new double[]{1.5, 1.5}, 2.5, 2.5),
                paper(1, 2022, new double[]{1.5, 1.5}, 2.5, 2.5));

        List<HIndexPoint> points = projector.project(papers);

        assertThat(points).containsExactly(
                new HIndexPoint(2022, 1, false),
                new HIndexPoint(2023, 2, false),
                new HIndexPoint(2024, 2, true),
                new HIndexPoint(2025, 2, true));
    }

    @Test
    @DisplayName("should return an empty timeline for an empty corpus")
    void shouldHandleEmptyCorpus() {
        assertThat(projector.project(List.of())).isEmpty();
    }
}
