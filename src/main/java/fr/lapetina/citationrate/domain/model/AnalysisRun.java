package fr.lapetina.citationrate.domain.model;

import java.util.List;

/**
 * Outcome of analysing a whole corpus, in input order.
 */
public record AnalysisRun(
        List<PaperAnalysis> papers,
        List<SeriesFailure> failures,
        List<HIndexPoint> hIndex
) {
    public AnalysisRun {
        papers = papers != null ? List.copyOf(papers) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        hIndex = hIndex != null ? List.copyOf(hIndex) : List.of();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
