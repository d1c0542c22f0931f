package fr.lapetina.citationrate.domain.noise;

import java.util.Arrays;

/**
 * How the observation variance of the filter is obtained. Resolved once per run
 * and handed to every consumer explicitly.
 *
 * <ul>
 *   <li>{@link Constant} - the same variance at every step</li>
 *   <li>{@link TimeVarying} - per-step variance from {@link NoiseModel} and the empirical rates</li>
 * </ul>
 */
public sealed interface ObservationVarianceMode
        permits ObservationVarianceMode.Constant, ObservationVarianceMode.TimeVarying {

    /** Observation variance used when no variance setting is configured at all. */
    double DEFAULT_CONSTANT_VARIANCE = 0.3;

    /**
     * Returns the mode name as written in the model metadata block.
     */
    String getName();

    /**
     * Builds the per-step variance sequence for a series.
     *
     * @param empiricalRates annualized empirical rates, one per step
     * @param minCount       pseudocount used for the log transform
     * @return one variance per step
     */
    double[] variances(double[] empiricalRates, double minCount);

    /**
     * Variance of a single step at the given rate.
     */
    double varianceAt(double rate, double minCount);

    /**
     * Resolves the mode from the two mutually exclusive settings. A constant
     * variance, when present, wins and disables the time-varying mode.
     *
     * @param obsVar         constant observation variance, or null
     * @param overdispersion overdispersion factor, or null
     * @param sigmaMinSq     floor for the time-varying mode
     */
    static ObservationVarianceMode resolve(Double obsVar, Double overdispersion, double sigmaMinSq) {
        if (obsVar != null) {
            return new Constant(obsVar);
        }
        if (overdispersion != null) {
            return new TimeVarying(overdispersion, sigmaMinSq);
        }
        return new Constant(DEFAULT_CONSTANT_VARIANCE);
    }

    /**
     * Constant observation variance.
     */
    record Constant(double value) implements ObservationVarianceMode {

        @Override
        public String getName() {
            return "obs_var";
        }

        @Override
        public double[] variances(double[] empiricalRates, double minCount) {
            double[] result = new double[empiricalRates.length];
            Arrays.fill(result, value);
            return result;
        }

        @Override
        public double varianceAt(double rate, double minCount) {
            return value;
        }
    }

    /**
     * Poisson-derived, time-varying observation variance scaled by an overdispersion factor.
     */
    record TimeVarying(double overdispersion, double sigmaMinSq) implements ObservationVarianceMode {

        public TimeVarying(double overdispersion) {
            this(overdispersion, NoiseModel.DEFAULT_SIGMA_MIN_SQ);
        }

        @Override
        public String getName() {
            return "obs_overdispersion";
        }

        @Override
        public double[] variances(double[] empiricalRates, double minCount) {
            return NoiseModel.variances(empiricalRates, overdispersion, minCount, sigmaMinSq);
        }

        @Override
        public double varianceAt(double rate, double minCount) {
            return NoiseModel.variance(rate, overdispersion, minCount, sigmaMinSq);
        }

        /**
         * Same overdispersion with a different floor.
         */
        public TimeVarying withFloor(double floor) {
            return new TimeVarying(overdispersion, floor);
        }
    }
}
