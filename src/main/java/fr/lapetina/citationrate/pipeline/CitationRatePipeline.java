package fr.lapetina.citationrate.pipeline;

import fr.lapetina.citationrate.domain.exception.InvalidInputException;
import fr.lapetina.citationrate.domain.exception.ModelConfigurationException;
import fr.lapetina.citationrate.domain.exception.NumericalDefectException;
import fr.lapetina.citationrate.domain.model.AnalysisRun;
import fr.lapetina.citationrate.domain.model.FailureType;
import fr.lapetina.citationrate.domain.model.FilterResult;
import fr.lapetina.citationrate.domain.model.Forecast;
import fr.lapetina.citationrate.domain.model.PaperAnalysis;
import fr.lapetina.citationrate.domain.model.PaperRecord;
import fr.lapetina.citationrate.domain.model.PreparedSeries;
import fr.lapetina.citationrate.domain.model.SeriesFailure;
import fr.lapetina.citationrate.domain.model.SmoothResult;
import fr.lapetina.citationrate.domain.noise.ObservationVarianceMode;
import fr.lapetina.citationrate.infrastructure.config.RateModelConfig;
import fr.lapetina.citationrate.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.citationrate.prepare.CaptureTimestamps;
import fr.lapetina.citationrate.prepare.SeriesPreparer;
import fr.lapetina.citationrate.statespace.Forecaster;
import fr.lapetina.citationrate.statespace.InitialState;
import fr.lapetina.citationrate.statespace.LocalLevelFilter;
import fr.lapetina.citationrate.statespace.RandomSources;
import fr.lapetina.citationrate.statespace.RtsSmoother;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Analysis pipeline: prepares, filters, smooths and optionally forecasts every paper of a corpus.
 *
 * <p>Papers are processed independently on the supplied executor and the results are
 * reassembled in input order. A paper that fails validation or hits a numerical defect
 * becomes a {@link SeriesFailure}; the other papers are still analysed. An unparsable
 * capture timestamp aborts the whole run.
 *
 * <p>Usage:
 * <pre>{@code
 * CitationRatePipeline pipeline = CitationRatePipeline.builder()
 *         .fromConfig(config)
 *         .executor(executor)
 *         .metricsRegistry(metrics)
 *         .build();
 * AnalysisRun run = pipeline.analyze(papers, "2024-06-30T00:00:00Z");
 * }</pre>
 */
public final class CitationRatePipeline {

    private static final Logger log = LoggerFactory.getLogger(CitationRatePipeline.class);

    /** Tolerance between the yearly sum and the reported total before a warning is raised. */
    static final double CONSISTENCY_TOLERANCE = 0.5;

    private final SeriesPreparer preparer;
    private final LocalLevelFilter filter;
    private final RtsSmoother smoother;
    private final Forecaster forecaster;
    private final ObservationVarianceMode varianceMode;
    private final HIndexProjector hIndexProjector;
    private final double processVariance;
    private final double minCount;
    private final double initialVariance;
    private final int forecastYears;
    private final Long seed;
    private final Executor executor;
    private final MetricsRegistry metricsRegistry;

    private CitationRatePipeline(Builder builder) {
        this.processVariance = builder.processVariance;
        this.minCount = builder.minCount;
        this.initialVariance = builder.initialVariance;
        this.forecastYears = builder.forecastYears;
        this.seed = builder.seed;
        this.varianceMode = builder.varianceMode;
        this.executor = builder.executor;
        this.metricsRegistry = builder.metricsRegistry;

        this.preparer = new SeriesPreparer(minCount);
        this.filter = new LocalLevelFilter(processVariance);
        this.smoother = new RtsSmoother();
        this.forecaster = new Forecaster(processVariance, varianceMode, minCount, builder.noiseFloor);
        this.hIndexProjector = new HIndexProjector();
    }

    /**
     * Analyses a corpus captured at {@code scrapedAt}.
     *
     * @throws InvalidInputException if the capture timestamp is missing or unparsable
     */
    public AnalysisRun analyze(List<PaperRecord> papers, String scrapedAt) {
        OffsetDateTime capturedAt = CaptureTimestamps.parse(scrapedAt);
        log.info("Analysing {} papers captured at {} (mode={}, processVar={}, forecastYears={})",
                papers.size(), capturedAt, varianceMode.getName(), processVariance, forecastYears);

        List<CompletableFuture<PaperOutcome>> futures = new ArrayList<>(papers.size());
        for (int i = 0; i < papers.size(); i++) {
            int index = i;
            PaperRecord paper = papers.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> analyzePaper(index, paper, capturedAt), executor));
        }

        List<PaperAnalysis> analyses = new ArrayList<>(papers.size());
        List<SeriesFailure> failures = new ArrayList<>();
        for (CompletableFuture<PaperOutcome> future : futures) {
            PaperOutcome outcome = future.join();
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                analyses.add(outcome.analysis());
            }
        }

        long start = System.nanoTime();
        AnalysisRun run = new AnalysisRun(analyses, failures, hIndexProjector.project(analyses));
        metricsRegistry.recordStageLatency("h_index", Duration.ofNanos(System.nanoTime() - start));

        log.info("Analysis complete: {} papers analysed, {} failed", analyses.size(), failures.size());
        return run;
    }

    private PaperOutcome analyzePaper(int index, PaperRecord paper, OffsetDateTime capturedAt) {
        String label = paper.title() != null && !paper.title().isBlank() ? paper.title() : "paper[" + index + "]";
        try {
            PaperAnalysis analysis = analyzeSeries(index, paper, capturedAt);
            metricsRegistry.incrementPaperCount(analysis.isEmpty() ? "empty" : "analyzed");
            return PaperOutcome.success(analysis);

        } catch (InvalidInputException e) {
            return fail(index, label, FailureType.INPUT_SHAPE, e);
        } catch (NumericalDefectException e) {
            return fail(index, label, FailureType.NUMERICAL_DEFECT, e);
        } catch (ModelConfigurationException e) {
            return fail(index, label, FailureType.MODEL_CONFIGURATION, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error analysing paper {} '{}'", index, label, e);
            return fail(index, label, FailureType.INTERNAL_ERROR, e);
        }
    }

    private PaperAnalysis analyzeSeries(int index, PaperRecord paper, OffsetDateTime capturedAt) {
        long start = System.nanoTime();
        PreparedSeries series = preparer.prepare(paper, capturedAt);
        recordStage("prepare", start);

        List<String> warnings = checkConsistency(paper, series);
        if (series.isEmpty()) {
            log.debug("Paper {} '{}' has no yearly citations", index, paper.title());
            return PaperAnalysis.empty(index, paper.title(), warnings);
        }

        String seriesId = series.seriesId();
        double[] observations = series.observations();
        double[] variances = varianceMode.variances(series.empiricalRate(), minCount);

        start = System.nanoTime();
        FilterResult filtered = filter.filter(seriesId, observations, variances,
                InitialState.seededFrom(observations[0], initialVariance));
        recordStage("filter", start);

        start = System.nanoTime();
        SmoothResult smoothed = smoother.smooth(seriesId, filtered);
        recordStage("smooth", start);

        Forecast forecast = Forecast.empty();
        if (forecastYears > 0) {
            start = System.nanoTime();
            forecast = forecaster.forecast(smoothed.finalMean(), smoothed.finalVariance(),
                    series.lastYear(), forecastYears, RandomSources.forSeries(seed, index));
            recordStage("forecast", start);
        }

        log.debug("Paper {} '{}': years={}, logLikelihood={}", index, seriesId, series.length(),
                filtered.logLikelihood());
        return new PaperAnalysis(index, paper.title(), series, smoothed, forecast, warnings);
    }

    private List<String> checkConsistency(PaperRecord paper, PreparedSeries series) {
        if (paper.totalCitations() == null) {
            return List.of();
        }
        double sum = 0.0;
        for (double count : series.counts()) {
            sum += count;
        }
        int total = paper.totalCitations().intValue();
        if (Math.abs(sum - total) > CONSISTENCY_TOLERANCE) {
            String warning = String.format("Yearly citations sum to %.0f but total_citations is %d", sum, total);
            log.warn("Paper '{}': {}", paper.title(), warning);
            return List.of(warning);
        }
        return List.of();
    }

    private PaperOutcome fail(int index, String label, FailureType type, RuntimeException e) {
        log.warn("Paper {} '{}' failed ({}): {}", index, label, type, e.getMessage());
        metricsRegistry.incrementPaperCount("failed");
        metricsRegistry.incrementFailureCount(type);
        return PaperOutcome.failure(new SeriesFailure(index, label, type, e.getMessage()));
    }

    private void recordStage(String stage, long startNanos) {
        metricsRegistry.recordStageLatency(stage, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public ObservationVarianceMode getVarianceMode() {
        return varianceMode;
    }

    public double getProcessVariance() {
        return processVariance;
    }

    public double getMinCount() {
        return minCount;
    }

    public int getForecastYears() {
        return forecastYears;
    }

    private record PaperOutcome(PaperAnalysis analysis, SeriesFailure failure) {
        static PaperOutcome success(PaperAnalysis analysis) {
            return new PaperOutcome(analysis, null);
        }

        static PaperOutcome failure(SeriesFailure failure) {
            return new PaperOutcome(null, failure);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double processVariance = 0.25;
        private ObservationVarianceMode varianceMode = new ObservationVarianceMode.TimeVarying(0.56);
        private double minCount = SeriesPreparer.DEFAULT_MIN_COUNT;
        private double initialVariance = InitialState.DEFAULT_VARIANCE;
        private int forecastYears = 0;
        private Long seed;
        private double noiseFloor = Forecaster.DEFAULT_NOISE_FLOOR;
        private Executor executor = Runnable::run;
        private MetricsRegistry metricsRegistry;

        public Builder fromConfig(RateModelConfig config) {
            RateModelConfig.ModelConfig model = config.getModel();
            this.processVariance = model.getProcessVar();
            this.varianceMode = model.resolveVarianceMode();
            this.minCount = model.getMinCount();
            this.initialVariance = model.getInitialVariance();
            this.forecastYears = config.getForecast().getYears();
            this.seed = config.getForecast().getSeed();
            this.noiseFloor = config.getForecast().getNoiseFloor();
            return this;
        }

        public Builder processVariance(double processVariance) {
            this.processVariance = processVariance;
            return this;
        }

        public Builder varianceMode(ObservationVarianceMode varianceMode) {
            this.varianceMode = varianceMode;
            return this;
        }

        public Builder minCount(double minCount) {
            this.minCount = minCount;
            return this;
        }

        public Builder initialVariance(double initialVariance) {
            this.initialVariance = initialVariance;
            return this;
        }

        public Builder forecastYears(int forecastYears) {
            this.forecastYears = forecastYears;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder noiseFloor(double noiseFloor) {
            this.noiseFloor = noiseFloor;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public CitationRatePipeline build() {
            Objects.requireNonNull(varianceMode, "Observation variance mode is required");
            Objects.requireNonNull(executor, "Executor is required");
            if (forecastYears < 0) {
                throw new ModelConfigurationException("Forecast horizon must be >= 0, got " + forecastYears);
            }
            if (!(initialVariance >= 0.0) || Double.isInfinite(initialVariance)) {
                throw new ModelConfigurationException("Initial variance must be finite and >= 0, got " + initialVariance);
            }
            if (initialVariance == 0.0 && processVariance == 0.0) {
                throw new ModelConfigurationException("Initial variance and process variance cannot both be zero");
            }
            if (metricsRegistry == null) {
                metricsRegistry = new MetricsRegistry();
            }
            return new CitationRatePipeline(this);
        }
    }
}
