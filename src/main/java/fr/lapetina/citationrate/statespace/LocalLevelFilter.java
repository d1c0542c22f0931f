package fr.lapetina.citationrate.statespace;

import fr.lapetina.citationrate.domain.exception.ModelConfigurationException;
import fr.lapetina.citationrate.domain.exception.NumericalDefectException;
import fr.lapetina.citationrate.domain.model.FilterResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forward Kalman filter for the scalar local-level model.
 *
 * <pre>
 *   x_t = x_{t-1} + eps_t,   eps_t ~ N(0, Q)
 *   z_t = x_t + eta_t,       eta_t ~ N(0, R_t)
 * </pre>
 *
 * No transition is applied at t = 0: the prediction there is the supplied prior.
 * The log-likelihood is accumulated from the innovations,
 * {@code -0.5 * (log(2 pi) + log(S_t) + v_t^2 / S_t)}.
 *
 * <p>Parameters are checked on entry. A negative process variance, a non-positive
 * observation variance, a negative prior variance, or a zero prior variance combined with
 * a zero process variance is a configuration error and is rejected with
 * {@link ModelConfigurationException}; nothing is masked.
 *
 * <p>Instances are immutable and can be shared across threads.
 */
public final class LocalLevelFilter {

    private static final Logger log = LoggerFactory.getLogger(LocalLevelFilter.class);

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    private final double processVariance;

    public LocalLevelFilter(double processVariance) {
        if (!Double.isFinite(processVariance) || processVariance < 0.0) {
            throw new ModelConfigurationException("Process variance must be finite and >= 0, got " + processVariance);
        }
        this.processVariance = processVariance;
    }

    public double getProcessVariance() {
        return processVariance;
    }

    /**
     * Runs the filter with the prior seeded from the first observation.
     *
     * @param seriesId             identity used in diagnostics
     * @param observations         log-rate observations z_t
     * @param observationVariances R_t, one per observation
     */
    public FilterResult filter(String seriesId, double[] observations, double[] observationVariances) {
        if (observations.length == 0) {
            checkVariances(seriesId, observations, observationVariances);
            return FilterResult.empty();
        }
        return filter(seriesId, observations, observationVariances, InitialState.seededFrom(observations[0]));
    }

    /**
     * Runs the filter from an explicit prior and keeps every intermediate state.
     */
    public FilterResult filter(
            String seriesId,
            double[] observations,
            double[] observationVariances,
            InitialState initial
    ) {
        checkVariances(seriesId, observations, observationVariances);
        int n = observations.length;
        if (n == 0) {
            return FilterResult.empty();
        }
        checkInitial(initial);

        double[] predictedMean = new double[n];
        double[] predictedVariance = new double[n];
        double[] filteredMean = new double[n];
        double[] filteredVariance = new double[n];

        double logLikelihood = recurse(seriesId, observations, observationVariances, initial,
                predictedMean, predictedVariance, filteredMean, filteredVariance);

        log.debug("Filtered series '{}': steps={}, logLikelihood={}", seriesId, n, logLikelihood);

        return new FilterResult(predictedMean, predictedVariance, filteredMean, filteredVariance, logLikelihood);
    }

    /**
     * Log-likelihood only, with the prior seeded from the first observation.
     * Allocates no per-step storage; this is the tuning hot path.
     */
    public double logLikelihood(String seriesId, double[] observations, double[] observationVariances) {
        checkVariances(seriesId, observations, observationVariances);
        if (observations.length == 0) {
            return 0.0;
        }
        InitialState initial = InitialState.seededFrom(observations[0]);
        checkInitial(initial);
        return recurse(seriesId, observations, observationVariances, initial, null, null, null, null);
    }

    /**
     * Shared recursion. Storage arrays are either all present or all null.
     */
    private double recurse(
            String seriesId,
            double[] z,
            double[] r,
            InitialState initial,
            double[] predictedMean,
            double[] predictedVariance,
            double[] filteredMean,
            double[] filteredVariance
    ) {
        boolean store = predictedMean != null;
        double xFilt = 0.0;
        double pFilt = 0.0;
        double logLikelihood = 0.0;

        for (int t = 0; t < z.length; t++) {
            double xPred;
            double pPred;
            if (t == 0) {
                xPred = initial.mean();
                pPred = initial.variance();
            } else {
                xPred = xFilt;
                pPred = pFilt + processVariance;
            }

            if (!Double.isFinite(z[t])) {
                throw new NumericalDefectException(seriesId, t, "observation is not finite: " + z[t]);
            }

            double innovation = z[t] - xPred;
            double innovationVariance = pPred + r[t];
            if (!(innovationVariance > 0.0) || !Double.isFinite(innovationVariance)) {
                throw new NumericalDefectException(seriesId, t,
                        "innovation variance must be finite and > 0, got " + innovationVariance);
            }

            double gain = pPred / innovationVariance;
            xFilt = xPred + gain * innovation;
            pFilt = (1.0 - gain) * pPred;

            logLikelihood += -0.5 * (LOG_2PI + Math.log(innovationVariance)
                    + innovation * innovation / innovationVariance);

            if (store) {
                predictedMean[t] = xPred;
                predictedVariance[t] = pPred;
                filteredMean[t] = xFilt;
                filteredVariance[t] = pFilt;
            }
        }
        return logLikelihood;
    }

    private static void checkVariances(String seriesId, double[] observations, double[] observationVariances) {
        if (observations.length != observationVariances.length) {
            throw new ModelConfigurationException("Series '" + seriesId + "': " + observations.length
                    + " observations but " + observationVariances.length + " observation variances");
        }
        for (int t = 0; t < observationVariances.length; t++) {
            double value = observationVariances[t];
            if (!(value > 0.0) || !Double.isFinite(value)) {
                throw new ModelConfigurationException("Series '" + seriesId + "': observation variance at t="
                        + t + " must be finite and > 0, got " + value);
            }
        }
    }

    private void checkInitial(InitialState initial) {
        if (!Double.isFinite(initial.mean()) || !Double.isFinite(initial.variance()) || initial.variance() < 0.0) {
            throw new ModelConfigurationException("Initial state must be finite with variance >= 0, got " + initial);
        }
        if (initial.variance() == 0.0 && processVariance == 0.0) {
            throw new ModelConfigurationException(
                    "Initial variance and process variance are both zero; every predicted variance would be zero");
        }
    }
}
