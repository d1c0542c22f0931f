package fr.lapetina.citationrate.domain.exception;

/**
 * Thrown when the state-space model is handed parameters it cannot run with:
 * negative process variance, non-positive observation variance, negative prior
 * variance, or observation and variance sequences of different lengths.
 */
public final class ModelConfigurationException extends RuntimeException {

    public ModelConfigurationException(String message) {
        super(message);
    }
}
