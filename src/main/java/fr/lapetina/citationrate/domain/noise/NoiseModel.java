package fr.lapetina.citationrate.domain.noise;

/**
 * Observation variance of a log-transformed count under a Poisson approximation.
 *
 * <p>For a Poisson count with rate {@code r}, the delta method gives
 * {@code Var[log(r + c)] ~ 1 / (r + c)}. The overdispersion {@code phi} scales that
 * variance and {@code sigmaMinSq} puts a floor under it:
 * <pre>
 *   R = phi / (r + c) + sigmaMinSq
 * </pre>
 */
public final class NoiseModel {

    /** Floor used when estimating and tuning. */
    public static final double DEFAULT_SIGMA_MIN_SQ = 0.01;

    private NoiseModel() {
        // Utility class
    }

    /**
     * Observation variance for a single empirical rate.
     *
     * @param rate           empirical rate, expected non-negative
     * @param overdispersion overdispersion factor phi; zero leaves only the floor
     * @param minCount       pseudocount c, strictly positive
     * @param sigmaMinSq     variance floor
     */
    public static double variance(double rate, double overdispersion, double minCount, double sigmaMinSq) {
        return overdispersion / (rate + minCount) + sigmaMinSq;
    }

    /**
     * Element-wise observation variance; the result has the length of {@code rates}.
     */
    public static double[] variances(double[] rates, double overdispersion, double minCount, double sigmaMinSq) {
        double[] result = new double[rates.length];
        for (int t = 0; t < rates.length; t++) {
            result[t] = variance(rates[t], overdispersion, minCount, sigmaMinSq);
        }
        return result;
    }
}
