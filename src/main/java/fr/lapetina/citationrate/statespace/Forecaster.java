package fr.lapetina.citationrate.statespace;

import fr.lapetina.citationrate.domain.exception.ModelConfigurationException;
import fr.lapetina.citationrate.domain.model.Forecast;
import fr.lapetina.citationrate.domain.model.ForecastStep;
import fr.lapetina.citationrate.domain.noise.ObservationVarianceMode;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

import java.util.ArrayList;
import java.util.List;

/**
 * Extends a smoothed trajectory past its last year.
 *
 * <p>Under the driftless random walk the predictive log-rate at horizon h is
 * {@code N(x_T, P_T + h Q)}. The rate-space summary follows the lognormal identities:
 * median {@code exp(x_T)} and variance {@code (exp(v) - 1) exp(2 x_T + v)}.
 *
 * <p>Each step also carries one sampled realization: a latent log-rate drawn from the
 * predictive distribution, then an observed log-rate drawn around it with the observation
 * variance at the sampled rate. Steps are sampled independently. The random source is
 * always supplied by the caller, so a seeded provider gives reproducible samples.
 */
public final class Forecaster {

    /** Variance floor used when sampling observed rates. */
    public static final double DEFAULT_NOISE_FLOOR = 0.0;

    private final double processVariance;
    private final ObservationVarianceMode samplingVarianceMode;
    private final double minCount;

    /**
     * @param processVariance Q, non-negative
     * @param varianceMode    observation variance mode of the run
     * @param minCount        pseudocount used for the log transform
     * @param noiseFloor      floor replacing the estimation floor when sampling in time-varying mode, non-negative
     */
    public Forecaster(double processVariance, ObservationVarianceMode varianceMode, double minCount, double noiseFloor) {
        if (!Double.isFinite(processVariance) || processVariance < 0.0) {
            throw new ModelConfigurationException("Process variance must be finite and >= 0, got " + processVariance);
        }
        if (!Double.isFinite(noiseFloor) || noiseFloor < 0.0) {
            throw new ModelConfigurationException("Forecast noise floor must be finite and >= 0, got " + noiseFloor);
        }
        this.processVariance = processVariance;
        this.minCount = minCount;
        if (varianceMode instanceof ObservationVarianceMode.TimeVarying timeVarying) {
            this.samplingVarianceMode = timeVarying.withFloor(noiseFloor);
        } else {
            this.samplingVarianceMode = varianceMode;
        }
    }

    public Forecaster(double processVariance, ObservationVarianceMode varianceMode, double minCount) {
        this(processVariance, varianceMode, minCount, DEFAULT_NOISE_FLOOR);
    }

    /**
     * Forecasts {@code horizon} years after {@code lastYear}.
     *
     * @param finalMean     smoothed log-rate at the last observed step
     * @param finalVariance smoothed variance at the last observed step, non-negative
     * @param lastYear      calendar year of the last observed step
     * @param horizon       number of years to forecast; zero gives an empty forecast
     * @param rng           random source for the sampled realizations
     */
    public Forecast forecast(double finalMean, double finalVariance, int lastYear, int horizon, UniformRandomProvider rng) {
        if (!Double.isFinite(finalVariance) || finalVariance < 0.0) {
            throw new ModelConfigurationException("Final smoothed variance must be finite and >= 0, got " + finalVariance);
        }
        if (horizon < 0) {
            throw new ModelConfigurationException("Forecast horizon must be >= 0, got " + horizon);
        }
        if (horizon == 0) {
            return Forecast.empty();
        }

        NormalizedGaussianSampler gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
        double median = Math.exp(finalMean);
        List<ForecastStep> steps = new ArrayList<>(horizon);

        for (int h = 1; h <= horizon; h++) {
            double variance = predictiveVariance(finalVariance, h);
            double rateVariance = Math.expm1(variance) * Math.exp(2.0 * finalMean + variance);

            double sampledLogRate = finalMean + Math.sqrt(variance) * gaussian.sample();
            double sampledRate = Math.exp(sampledLogRate);
            double noise = samplingVarianceMode.varianceAt(sampledRate, minCount);
            double observedLogRate = sampledLogRate + Math.sqrt(noise) * gaussian.sample();

            steps.add(new ForecastStep(
                    h,
                    lastYear + h,
                    variance,
                    median,
                    Math.sqrt(rateVariance),
                    sampledLogRate,
                    Math.exp(observedLogRate)
            ));
        }
        return new Forecast(steps);
    }

    /**
     * Predictive log-rate variance at horizon {@code h}: {@code P_T + h Q}.
     */
    public double predictiveVariance(double finalVariance, int h) {
        return finalVariance + h * processVariance;
    }

    public double getProcessVariance() {
        return processVariance;
    }
}
