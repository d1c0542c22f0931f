package fr.lapetina.citationrate.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of tuning on a corpus: the grid result plus the papers that failed.
 *
 * @param papersWithData number of papers with at least one yearly count
 * @param failures       papers rejected before the grid search or left out of grid cells, by paper index
 * @param gridResult     scores and optimum of the grid search
 */
public record TuningRun(int papersWithData, List<SeriesFailure> failures, HyperparameterGridResult gridResult) {

    public TuningRun {
        Objects.requireNonNull(gridResult, "Grid result is required");
        failures = failures != null ? List.copyOf(failures) : List.of();
    }
}
