package fr.lapetina.citationrate.domain.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A paper as delivered by the citation source: a title, an optional total
 * citation figure, and the raw year-key to count mapping.
 * Immutable and thread-safe.
 *
 * <p>Year keys and counts are kept as delivered; they are validated when the series
 * is prepared. A count may therefore be null, fractional or NaN at this stage.
 */
public record PaperRecord(
        String title,
        Number totalCitations,
        Map<String, Number> citationsByYear
) {
    public PaperRecord {
        citationsByYear = citationsByYear != null
                ? Collections.unmodifiableMap(new TreeMap<>(citationsByYear))
                : Map.of();
    }

    public static PaperRecord of(String title, Map<String, ? extends Number> citationsByYear) {
        return new PaperRecord(title, null, citationsByYear != null ? new TreeMap<String, Number>(citationsByYear) : null);
    }

    public boolean hasCitations() {
        return !citationsByYear.isEmpty();
    }
}
