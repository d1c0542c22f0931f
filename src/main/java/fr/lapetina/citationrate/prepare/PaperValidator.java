package fr.lapetina.citationrate.prepare;

import fr.lapetina.citationrate.domain.exception.InvalidInputException;
import fr.lapetina.citationrate.domain.model.PaperRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Validates paper records before they are turned into series.
 *
 * Validates:
 * - Paper is not null and has a non-blank title
 * - Every year key is a 4-digit decimal year
 * - Every count is present, non-negative and a whole number
 * - The reported total, when present, is a count as well
 *
 * An empty citation map is valid.
 */
public final class PaperValidator {

    private static final Logger log = LoggerFactory.getLogger(PaperValidator.class);

    private static final Pattern YEAR_KEY = Pattern.compile("\\d{4}");

    /**
     * Validates the record and returns its citations keyed by integer year, in year order.
     *
     * @throws InvalidInputException on the first shape violation found
     */
    public SortedMap<Integer, Integer> validate(PaperRecord paper) {
        if (paper == null || paper.title() == null || paper.title().isBlank()) {
            throw new InvalidInputException(InvalidInputException.Reason.MISSING_TITLE);
        }

        if (paper.totalCitations() != null && !isCount(paper.totalCitations())) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_COUNT,
                    "total_citations=" + paper.totalCitations() + " in paper '" + paper.title() + "'");
        }

        SortedMap<Integer, Integer> byYear = new TreeMap<>();
        for (Map.Entry<String, Number> entry : paper.citationsByYear().entrySet()) {
            String key = entry.getKey();
            if (key == null || !YEAR_KEY.matcher(key).matches()) {
                throw new InvalidInputException(InvalidInputException.Reason.MALFORMED_YEAR_KEY,
                        "'" + key + "' in paper '" + paper.title() + "'");
            }
            Number count = entry.getValue();
            if (count == null || !isCount(count)) {
                throw new InvalidInputException(InvalidInputException.Reason.INVALID_COUNT,
                        key + "=" + count + " in paper '" + paper.title() + "'");
            }
            byYear.put(Integer.parseInt(key), count.intValue());
        }

        log.debug("Paper validated: title='{}', years={}", paper.title(), byYear.size());
        return byYear;
    }

    /**
     * A finite, non-negative whole number that fits an int. Fractions are rejected rather than truncated.
     */
    static boolean isCount(Number value) {
        double d = value.doubleValue();
        return Double.isFinite(d) && d >= 0.0 && d <= Integer.MAX_VALUE && d == Math.rint(d);
    }
}
