package fr.lapetina.citationrate.domain.exception;

/**
 * Exception thrown when an input document or paper record has an invalid shape.
 *
 * This occurs when:
 * - A paper record has no title
 * - A year key is not a 4-digit decimal year
 * - A yearly count or the reported total is missing, negative or not a whole number
 * - The capture timestamp is missing or cannot be parsed
 */
public final class InvalidInputException extends RuntimeException {

    private final Reason reason;

    public InvalidInputException(Reason reason) {
        super("Invalid input: " + reason.getMessage());
        this.reason = reason;
    }

    public InvalidInputException(Reason reason, String details) {
        super("Invalid input: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public InvalidInputException(Reason reason, String details, Throwable cause) {
        super("Invalid input: " + reason.getMessage() + " - " + details, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        MISSING_TITLE("Paper record has no title"),
        MALFORMED_YEAR_KEY("Year key is not a 4-digit year"),
        INVALID_COUNT("Citation count is missing, negative or not a whole number"),
        MISSING_TIMESTAMP("Capture timestamp is missing"),
        UNPARSABLE_TIMESTAMP("Capture timestamp cannot be parsed");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
