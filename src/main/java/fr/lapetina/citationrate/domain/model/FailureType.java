package fr.lapetina.citationrate.domain.model;

/**
 * Failure taxonomy for per-series processing.
 * Keeps failures categorized for logging, metrics and the output document.
 */
public enum FailureType {
    /** Paper record is malformed: missing title, bad year key, missing, negative or fractional count */
    INPUT_SHAPE,

    /** A recursion produced a value that signals numerical pathology */
    NUMERICAL_DEFECT,

    /** Model parameters rejected at the filter boundary */
    MODEL_CONFIGURATION,

    /** Anything else */
    INTERNAL_ERROR
}
