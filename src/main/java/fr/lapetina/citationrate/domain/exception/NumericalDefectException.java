package fr.lapetina.citationrate.domain.exception;

/**
 * Raised when a recursion produces a value that can only come from upstream
 * numerical pathology, such as a negative smoothed variance or a non-finite
 * innovation variance. Carries the identity of the series being processed.
 */
public final class NumericalDefectException extends RuntimeException {

    private final String seriesId;
    private final int timeIndex;

    public NumericalDefectException(String seriesId, int timeIndex, String message) {
        super("Series '" + seriesId + "' at t=" + timeIndex + ": " + message);
        this.seriesId = seriesId;
        this.timeIndex = timeIndex;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public int getTimeIndex() {
        return timeIndex;
    }
}
