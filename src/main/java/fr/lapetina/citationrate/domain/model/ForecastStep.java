package fr.lapetina.citationrate.domain.model;

/**
 * One horizon step of a forecast.
 *
 * @param horizon          steps ahead of the final smoothed state (1-based)
 * @param year             calendar year of the step
 * @param logRateVariance  predictive variance of the log-rate
 * @param rateMedian       median of the rate (lognormal)
 * @param rateStd          standard deviation of the rate (lognormal)
 * @param sampledLogRate   one draw of the latent log-rate
 * @param sampledRate      one draw of the observed rate given that latent draw
 */
public record ForecastStep(
        int horizon,
        int year,
        double logRateVariance,
        double rateMedian,
        double rateStd,
        double sampledLogRate,
        double sampledRate
) {
}
