package fr.lapetina.citationrate.pipeline;

import fr.lapetina.citationrate.domain.model.HIndexPoint;
import fr.lapetina.citationrate.domain.model.PaperAnalysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Projects the h-index of a corpus over time from smoothed and forecast citation rates.
 *
 * <p>For every year of the timeline each paper accumulates its smoothed rate for that year
 * when the year is observed, or its forecast median when the year is forecast. The h-index
 * of the accumulated totals is the largest {@code h} such that {@code h} papers have at
 * least {@code h} accumulated citations. A year is flagged as forecast when no paper
 * observed it.
 */
public final class HIndexProjector {

    public List<HIndexPoint> project(List<PaperAnalysis> papers) {
        SortedSet<Integer> observedYears = new TreeSet<>();
        SortedSet<Integer> timeline = new TreeSet<>();
        List<Map<Integer, Double>> yearlyRates = new ArrayList<>(papers.size());

        for (PaperAnalysis paper : papers) {
            Map<Integer, Double> rates = new HashMap<>();
            if (paper.hasForecast()) {
                List<Integer> forecastYears = paper.forecast().years();
                List<Double> medians = paper.forecast().rateMedians();
                for (int h = 0; h < forecastYears.size(); h++) {
                    rates.put(forecastYears.get(h), medians.get(h));
                    timeline.add(forecastYears.get(h));
                }
            }
            // Observed years take precedence over forecast years.
            int[] years = paper.series().years();
            double[] smoothed = paper.smoothedRate();
            for (int t = 0; t < years.length; t++) {
                rates.put(years[t], smoothed[t]);
                observedYears.add(years[t]);
                timeline.add(years[t]);
            }
            yearlyRates.add(rates);
        }

        double[] accumulated = new double[papers.size()];
        List<HIndexPoint> points = new ArrayList<>(timeline.size());
        for (int year : timeline) {
            for (int i = 0; i < accumulated.length; i++) {
                accumulated[i] += yearlyRates.get(i).getOrDefault(year, 0.0);
            }
            points.add(new HIndexPoint(year, hIndex(accumulated), !observedYears.contains(year)));
        }
        return points;
    }

    static int hIndex(double[] citations) {
        double[] sorted = citations.clone();
        Arrays.sort(sorted);
        int h = 0;
        for (int i = sorted.length - 1; i >= 0; i--) {
            int rank = sorted.length - i;
            if (sorted[i] >= rank) {
                h = rank;
            } else {
                break;
            }
        }
        return h;
    }
}
