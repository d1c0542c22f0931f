package fr.lapetina.citationrate.prepare;

import fr.lapetina.citationrate.domain.exception.InvalidInputException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parsing of the capture timestamp and the exposure of the capture year.
 */
public final class CaptureTimestamps {

    // date, optionally followed by a time, optionally followed by an offset
    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private CaptureTimestamps() {
        // Utility class
    }

    /**
     * Parses an ISO-8601 capture timestamp.
     *
     * <p>A trailing {@code Z} is rewritten to {@code +00:00}. A timestamp without an offset
     * is taken as UTC. A bare date means midnight UTC.
     *
     * @throws InvalidInputException if the value is missing or cannot be parsed
     */
    public static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(InvalidInputException.Reason.MISSING_TIMESTAMP);
        }
        String normalized = value.trim();
        if (normalized.endsWith("Z")) {
            normalized = normalized.substring(0, normalized.length() - 1) + "+00:00";
        }

        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(normalized,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime;
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.atOffset(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException(InvalidInputException.Reason.UNPARSABLE_TIMESTAMP, value, e);
        }
    }

    /**
     * Fraction of the capture year already elapsed at the capture instant, measured in
     * the capture's own offset. Values outside (0, 1] fall back to 1.
     */
    public static double exposureFraction(OffsetDateTime capturedAt) {
        ZoneOffset offset = capturedAt.getOffset();
        int year = capturedAt.getYear();
        OffsetDateTime yearStart = OffsetDateTime.of(year, 1, 1, 0, 0, 0, 0, offset);
        OffsetDateTime nextYearStart = yearStart.plusYears(1);

        double total = seconds(Duration.between(yearStart, nextYearStart));
        double elapsed = seconds(Duration.between(yearStart, capturedAt));
        double fraction = elapsed / total;

        if (!(fraction > 0.0 && fraction <= 1.0)) {
            return 1.0;
        }
        return fraction;
    }

    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1e9;
    }
}
