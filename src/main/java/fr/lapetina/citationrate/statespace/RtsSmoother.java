package fr.lapetina.citationrate.statespace;

import fr.lapetina.citationrate.domain.exception.NumericalDefectException;
import fr.lapetina.citationrate.domain.model.FilterResult;
import fr.lapetina.citationrate.domain.model.SmoothResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rauch-Tung-Striebel backward pass over a completed filter pass.
 *
 * <p>The terminal smoothed state equals the last filtered state. For t = T-2 down to 0:
 * <pre>
 *   C_t     = P_t|t / P_t+1|t
 *   x_t|T   = x_t|t + C_t (x_t+1|T - x_t+1|t)
 *   P_t|T   = P_t|t + C_t^2 (P_t+1|T - P_t+1|t)
 * </pre>
 * A negative smoothed variance is reported, never clamped.
 */
public final class RtsSmoother {

    private static final Logger log = LoggerFactory.getLogger(RtsSmoother.class);

    /**
     * Smooths one series.
     *
     * @param seriesId identity used in diagnostics
     * @param filtered complete output of the forward pass
     */
    public SmoothResult smooth(String seriesId, FilterResult filtered) {
        int n = filtered.length();
        if (n == 0) {
            return SmoothResult.empty();
        }

        double[] predictedMean = filtered.predictedMean();
        double[] predictedVariance = filtered.predictedVariance();
        double[] smoothedMean = filtered.filteredMean();
        double[] smoothedVariance = filtered.filteredVariance();

        // smoothedMean/Variance start as copies of the filtered state, so index T-1 is already final
        for (int t = n - 2; t >= 0; t--) {
            double denominator = predictedVariance[t + 1];
            if (!(denominator > 0.0)) {
                throw new NumericalDefectException(seriesId, t,
                        "predicted variance at t+1 must be > 0 for the smoother gain, got " + denominator);
            }
            double gain = smoothedVariance[t] / denominator;
            smoothedMean[t] = smoothedMean[t] + gain * (smoothedMean[t + 1] - predictedMean[t + 1]);
            smoothedVariance[t] = smoothedVariance[t]
                    + gain * gain * (smoothedVariance[t + 1] - predictedVariance[t + 1]);

            if (smoothedVariance[t] < 0.0 || !Double.isFinite(smoothedVariance[t])) {
                throw new NumericalDefectException(seriesId, t,
                        "smoothed variance is negative or not finite: " + smoothedVariance[t]);
            }
        }

        log.debug("Smoothed series '{}': steps={}", seriesId, n);
        return new SmoothResult(smoothedMean, smoothedVariance);
    }
}
