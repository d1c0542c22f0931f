package fr.lapetina.citationrate.domain.model;

import java.util.Objects;

/**
 * A per-series failure, surfaced with enough context to find the offending paper.
 *
 * @param index   position of the paper in the input document
 * @param seriesId identifier of the series (the title, or a positional fallback)
 * @param type    failure category
 * @param message diagnostic message
 */
public record SeriesFailure(int index, String seriesId, FailureType type, String message) {

    public SeriesFailure {
        Objects.requireNonNull(seriesId, "Series id is required");
        Objects.requireNonNull(type, "Failure type is required");
    }
}
