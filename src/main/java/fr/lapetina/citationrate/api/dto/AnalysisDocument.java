package fr.lapetina.citationrate.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.citationrate.domain.model.AnalysisRun;
import fr.lapetina.citationrate.domain.model.Forecast;
import fr.lapetina.citationrate.domain.model.HIndexPoint;
import fr.lapetina.citationrate.domain.model.PaperAnalysis;
import fr.lapetina.citationrate.domain.model.PreparedSeries;
import fr.lapetina.citationrate.domain.model.SeriesFailure;
import fr.lapetina.citationrate.domain.noise.ObservationVarianceMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Output document of the analysis path: smoothed rates, optional forecasts and the
 * projected h-index for every paper of the input document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisDocument {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("scraped_at")
    private String scrapedAt;

    @JsonProperty("generated_at")
    private Instant generatedAt;

    private ModelInfo model;
    private List<PaperResult> papers = new ArrayList<>();

    @JsonProperty("h_index")
    private List<HIndexEntry> hIndex = new ArrayList<>();

    private List<FailureEntry> failures = new ArrayList<>();

    /**
     * Builds the document from a completed run.
     */
    public static AnalysisDocument from(
            CitationsDocument input,
            AnalysisRun run,
            ModelInfo model,
            ForecastAssumptions assumptions
    ) {
        AnalysisDocument document = new AnalysisDocument();
        document.setUserId(input.getUserId());
        document.setScrapedAt(input.getScrapedAt());
        document.setGeneratedAt(Instant.now());
        document.setModel(model);
        document.setPapers(run.papers().stream()
                .map(paper -> PaperResult.from(paper, assumptions))
                .toList());
        document.setHIndex(run.hIndex().stream().map(HIndexEntry::from).toList());
        document.setFailures(run.failures().stream().map(FailureEntry::from).toList());
        return document;
    }

    // Getters and setters
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getScrapedAt() { return scrapedAt; }
    public void setScrapedAt(String scrapedAt) { this.scrapedAt = scrapedAt; }

    public Instant getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }

    public ModelInfo getModel() { return model; }
    public void setModel(ModelInfo model) { this.model = model; }

    public List<PaperResult> getPapers() { return papers; }
    public void setPapers(List<PaperResult> papers) { this.papers = papers; }

    @JsonProperty("h_index")
    public List<HIndexEntry> getHIndex() { return hIndex; }
    @JsonProperty("h_index")
    public void setHIndex(List<HIndexEntry> hIndex) { this.hIndex = hIndex; }

    public List<FailureEntry> getFailures() { return failures; }
    public void setFailures(List<FailureEntry> failures) { this.failures = failures; }

    /**
     * Model metadata: which variance mode was used and with what parameters.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ModelInfo {
        private String type = "kalman";

        @JsonProperty("process_var")
        private double processVar;

        @JsonProperty("min_count")
        private double minCount;

        @JsonProperty("obs_var")
        private Double obsVar;

        @JsonProperty("obs_overdispersion")
        private Double obsOverdispersion;

        public static ModelInfo of(double processVar, double minCount, ObservationVarianceMode mode) {
            ModelInfo info = new ModelInfo();
            info.setProcessVar(processVar);
            info.setMinCount(minCount);
            if (mode instanceof ObservationVarianceMode.Constant constant) {
                info.setObsVar(constant.value());
            } else if (mode instanceof ObservationVarianceMode.TimeVarying timeVarying) {
                info.setObsOverdispersion(timeVarying.overdispersion());
            }
            return info;
        }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public double getProcessVar() { return processVar; }
        public void setProcessVar(double processVar) { this.processVar = processVar; }

        public double getMinCount() { return minCount; }
        public void setMinCount(double minCount) { this.minCount = minCount; }

        public Double getObsVar() { return obsVar; }
        public void setObsVar(Double obsVar) { this.obsVar = obsVar; }

        public Double getObsOverdispersion() { return obsOverdispersion; }
        public void setObsOverdispersion(Double obsOverdispersion) { this.obsOverdispersion = obsOverdispersion; }
    }

    /**
     * Assumptions behind the forecasts of a run.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ForecastAssumptions {
        private String model = "local_level_random_walk";

        @JsonProperty("process_var")
        private double processVar;

        private Double overdispersion;

        @JsonProperty("obs_var")
        private Double obsVar;

        @JsonProperty("min_count")
        private double minCount;

        public static ForecastAssumptions of(double processVar, double minCount, ObservationVarianceMode mode) {
            ForecastAssumptions assumptions = new ForecastAssumptions();
            assumptions.setProcessVar(processVar);
            assumptions.setMinCount(minCount);
            if (mode instanceof ObservationVarianceMode.TimeVarying timeVarying) {
                assumptions.setOverdispersion(timeVarying.overdispersion());
            } else if (mode instanceof ObservationVarianceMode.Constant constant) {
                assumptions.setObsVar(constant.value());
            }
            return assumptions;
        }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public double getProcessVar() { return processVar; }
        public void setProcessVar(double processVar) { this.processVar = processVar; }

        public Double getOverdispersion() { return overdispersion; }
        public void setOverdispersion(Double overdispersion) { this.overdispersion = overdispersion; }

        public Double getObsVar() { return obsVar; }
        public void setObsVar(Double obsVar) { this.obsVar = obsVar; }

        public double getMinCount() { return minCount; }
        public void setMinCount(double minCount) { this.minCount = minCount; }
    }

    /**
     * Per-paper result. Forecast fields are absent when no forecast was made.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PaperResult {
        private String title;
        private List<Integer> years;

        @JsonProperty("observed_citations")
        private List<Double> observedCitations;

        @JsonProperty("exposure_fraction")
        private List<Double> exposureFraction;

        @JsonProperty("empirical_rate")
        private List<Double> empiricalRate;

        @JsonProperty("smoothed_rate")
        private List<Double> smoothedRate;

        @JsonProperty("smoothed_log_rate")
        private List<Double> smoothedLogRate;

        @JsonProperty("smoothed_rate_std")
        private List<Double> smoothedRateStd;

        @JsonProperty("forecast_years")
        private List<Integer> forecastYears;

        @JsonProperty("forecast_log_rate_var")
        private List<Double> forecastLogRateVar;

        @JsonProperty("forecast_rate_median")
        private List<Double> forecastRateMedian;

        @JsonProperty("forecast_rate_std")
        private List<Double> forecastRateStd;

        @JsonProperty("forecast_sampled_log_rate")
        private List<Double> forecastSampledLogRate;

        @JsonProperty("forecast_sampled_rate")
        private List<Double> forecastSampledRate;

        @JsonProperty("forecast_assumptions")
        private ForecastAssumptions forecastAssumptions;

        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private List<String> warnings;

        public static PaperResult from(PaperAnalysis analysis, ForecastAssumptions assumptions) {
            PreparedSeries series = analysis.series();
            PaperResult result = new PaperResult();
            result.setTitle(analysis.title());
            result.setYears(Arrays.stream(series.years()).boxed().toList());
            result.setObservedCitations(toList(series.counts()));
            result.setExposureFraction(toList(series.exposure()));
            result.setEmpiricalRate(toList(series.empiricalRate()));
            result.setSmoothedRate(toList(analysis.smoothedRate()));
            result.setSmoothedLogRate(toList(analysis.smoothedLogRate()));
            result.setSmoothedRateStd(toList(analysis.smoothedRateStd()));

            if (analysis.hasForecast()) {
                Forecast forecast = analysis.forecast();
                result.setForecastYears(forecast.years());
                result.setForecastLogRateVar(forecast.logRateVariances());
                result.setForecastRateMedian(forecast.rateMedians());
                result.setForecastRateStd(forecast.rateStds());
                result.setForecastSampledLogRate(forecast.sampledLogRates());
                result.setForecastSampledRate(forecast.sampledRates());
                result.setForecastAssumptions(assumptions);
            }
            result.setWarnings(analysis.warnings());
            return result;
        }

        private static List<Double> toList(double[] values) {
            return Arrays.stream(values).boxed().toList();
        }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public List<Integer> getYears() { return years; }
        public void setYears(List<Integer> years) { this.years = years; }

        public List<Double> getObservedCitations() { return observedCitations; }
        public void setObservedCitations(List<Double> observedCitations) { this.observedCitations = observedCitations; }

        public List<Double> getExposureFraction() { return exposureFraction; }
        public void setExposureFraction(List<Double> exposureFraction) { this.exposureFraction = exposureFraction; }

        public List<Double> getEmpiricalRate() { return empiricalRate; }
        public void setEmpiricalRate(List<Double> empiricalRate) { this.empiricalRate = empiricalRate; }

        public List<Double> getSmoothedRate() { return smoothedRate; }
        public void setSmoothedRate(List<Double> smoothedRate) { this.smoothedRate = smoothedRate; }

        public List<Double> getSmoothedLogRate() { return smoothedLogRate; }
        public void setSmoothedLogRate(List<Double> smoothedLogRate) { this.smoothedLogRate = smoothedLogRate; }

        public List<Double> getSmoothedRateStd() { return smoothedRateStd; }
        public void setSmoothedRateStd(List<Double> smoothedRateStd) { this.smoothedRateStd = smoothedRateStd; }

        public List<Integer> getForecastYears() { return forecastYears; }
        public void setForecastYears(List<Integer> forecastYears) { this.forecastYears = forecastYears; }

        public List<Double> getForecastLogRateVar() { return forecastLogRateVar; }
        public void setForecastLogRateVar(List<Double> forecastLogRateVar) { this.forecastLogRateVar = forecastLogRateVar; }

        public List<Double> getForecastRateMedian() { return forecastRateMedian; }
        public void setForecastRateMedian(List<Double> forecastRateMedian) { this.forecastRateMedian = forecastRateMedian; }

        public List<Double> getForecastRateStd() { return forecastRateStd; }
        public void setForecastRateStd(List<Double> forecastRateStd) { this.forecastRateStd = forecastRateStd; }

        public List<Double> getForecastSampledLogRate() { return forecastSampledLogRate; }
        public void setForecastSampledLogRate(List<Double> forecastSampledLogRate) { this.forecastSampledLogRate = forecastSampledLogRate; }

        public List<Double> getForecastSampledRate() { return forecastSampledRate; }
        public void setForecastSampledRate(List<Double> forecastSampledRate) { this.forecastSampledRate = forecastSampledRate; }

        public ForecastAssumptions getForecastAssumptions() { return forecastAssumptions; }
        public void setForecastAssumptions(ForecastAssumptions forecastAssumptions) { this.forecastAssumptions = forecastAssumptions; }

        public List<String> getWarnings() { return warnings; }
        public void setWarnings(List<String> warnings) { this.warnings = warnings; }
    }

    public static class HIndexEntry {
        private int year;

        @JsonProperty("h_index")
        private int hIndex;

        private boolean forecast;

        public static HIndexEntry from(HIndexPoint point) {
            HIndexEntry entry = new HIndexEntry();
            entry.setYear(point.year());
            entry.setHIndex(point.hIndex());
            entry.setForecast(point.forecast());
            return entry;
        }

        public int getYear() { return year; }
        public void setYear(int year) { this.year = year; }

        @JsonProperty("h_index")
        public int getHIndex() { return hIndex; }
        @JsonProperty("h_index")
        public void setHIndex(int hIndex) { this.hIndex = hIndex; }

        public boolean isForecast() { return forecast; }
        public void setForecast(boolean forecast) { this.forecast = forecast; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FailureEntry {
        private int index;
        private String title;

        @JsonProperty("error_type")
        private String errorType;

        private String error;

        public static FailureEntry from(SeriesFailure failure) {
            FailureEntry entry = new FailureEntry();
            entry.setIndex(failure.index());
            entry.setTitle(failure.seriesId());
            entry.setErrorType(failure.type().name());
            entry.setError(failure.message());
            return entry;
        }

        public int getIndex() { return index; }
        public void setIndex(int index) { this.index = index; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getErrorType() { return errorType; }
        public void setErrorType(String errorType) { this.errorType = errorType; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }
}
