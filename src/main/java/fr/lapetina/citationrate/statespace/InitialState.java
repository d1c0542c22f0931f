package fr.lapetina.citationrate.statespace;

/**
 * Prior on the latent log-rate at the first time step.
 *
 * @param mean     prior mean
 * @param variance prior variance, non-negative
 */
public record InitialState(double mean, double variance) {

    /** Prior variance used when the caller does not override it. */
    public static final double DEFAULT_VARIANCE = 1.0;

    /**
     * Seeds the prior from the first observation with the default variance.
     */
    public static InitialState seededFrom(double firstObservation) {
        return new InitialState(firstObservation, DEFAULT_VARIANCE);
    }

    public static InitialState seededFrom(double firstObservation, double variance) {
        return new InitialState(firstObservation, variance);
    }
}
