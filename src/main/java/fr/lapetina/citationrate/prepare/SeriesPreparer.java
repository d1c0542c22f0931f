package fr.lapetina.citationrate.prepare;

import fr.lapetina.citationrate.domain.model.PaperRecord;
import fr.lapetina.citationrate.domain.model.PreparedSeries;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Map;
import java.util.SortedMap;

/**
 * Turns a raw year-to-count mapping into the series consumed by the filter.
 *
 * <p>The year axis holds exactly the years present in the mapping. Every year has full
 * exposure except the last one when it is the capture year, whose exposure is the elapsed
 * fraction of that year. Empirical rates annualize counts by exposure, and observations are
 * {@code log(rate + minCount)}.
 */
public final class SeriesPreparer {

    /** Pseudocount used when none is configured. */
    public static final double DEFAULT_MIN_COUNT = 0.5;

    private static final double MIN_EXPOSURE = 1e-6;

    private final double minCount;
    private final PaperValidator validator;

    public SeriesPreparer(double minCount) {
        this(minCount, new PaperValidator());
    }

    public SeriesPreparer(double minCount, PaperValidator validator) {
        if (!(minCount > 0.0) || !Double.isFinite(minCount)) {
            throw new IllegalArgumentException("Pseudocount must be finite and > 0, got " + minCount);
        }
        this.minCount = minCount;
        this.validator = validator;
    }

    public double getMinCount() {
        return minCount;
    }

    /**
     * Validates and prepares one paper.
     *
     * @param paper      raw paper record
     * @param capturedAt instant the counts were captured
     * @return the prepared series, empty when the paper has no yearly counts
     * @throws fr.lapetina.citationrate.domain.exception.InvalidInputException if the record is malformed
     */
    public PreparedSeries prepare(PaperRecord paper, OffsetDateTime capturedAt) {
        SortedMap<Integer, Integer> byYear = validator.validate(paper);
        String seriesId = paper.title();
        if (byYear.isEmpty()) {
            return PreparedSeries.empty(seriesId);
        }

        int n = byYear.size();
        int[] years = new int[n];
        double[] counts = new double[n];
        int i = 0;
        for (Map.Entry<Integer, Integer> entry : byYear.entrySet()) {
            years[i] = entry.getKey();
            counts[i] = entry.getValue();
            i++;
        }

        double[] exposure = new double[n];
        Arrays.fill(exposure, 1.0);
        if (years[n - 1] == capturedAt.getYear()) {
            exposure[n - 1] = CaptureTimestamps.exposureFraction(capturedAt);
        }

        double[] empiricalRate = new double[n];
        double[] observations = new double[n];
        for (int t = 0; t < n; t++) {
            empiricalRate[t] = counts[t] / Math.max(exposure[t], MIN_EXPOSURE);
            observations[t] = Math.log(empiricalRate[t] + minCount);
        }

        return new PreparedSeries(seriesId, years, counts, exposure, empiricalRate, observations);
    }
}
