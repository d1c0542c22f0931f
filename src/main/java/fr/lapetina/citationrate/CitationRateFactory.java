package fr.lapetina.citationrate;

import fr.lapetina.citationrate.infrastructure.config.ConfigLoader;
import fr.lapetina.citationrate.infrastructure.config.RateModelConfig;
import fr.lapetina.citationrate.infrastructure.io.JsonDocumentStore;
import fr.lapetina.citationrate.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.citationrate.pipeline.CitationRatePipeline;
import fr.lapetina.citationrate.pipeline.TuningPipeline;
import fr.lapetina.citationrate.pipeline.WorkerThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating fully-wired pipelines from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (CitationRateFactory factory = CitationRateFactory.create("citation-rates.yaml")) {
 *     AnalysisRun run = factory.getAnalysisPipeline().analyze(papers, scrapedAt);
 * }
 * }</pre>
 */
public class CitationRateFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CitationRateFactory.class);

    private final RateModelConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService executor;
    private final JsonDocumentStore documentStore;
    private final CitationRatePipeline analysisPipeline;
    private final TuningPipeline tuningPipeline;

    protected CitationRateFactory(RateModelConfig config) {
        this.config = config;

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Worker pool shared by analysis and tuning
        int parallelism = config.getExecution().effectiveParallelism();
        this.executor = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory("citation-worker"));

        this.documentStore = new JsonDocumentStore();

        this.analysisPipeline = CitationRatePipeline.builder()
                .fromConfig(config)
                .executor(executor)
                .metricsRegistry(metricsRegistry)
                .build();

        this.tuningPipeline = new TuningPipeline(config, executor, metricsRegistry);

        log.info("CitationRateFactory initialized: parallelism={}, mode={}",
                parallelism, analysisPipeline.getVarianceMode().getName());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static CitationRateFactory create(String configPath) {
        log.info("Initializing CitationRateFactory from config: {}", configPath);
        return new CitationRateFactory(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a factory from the default configuration (citation-rates.yaml).
     */
    public static CitationRateFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static CitationRateFactory create(RateModelConfig config) {
        ConfigLoader.validate(config);
        return new CitationRateFactory(config);
    }

    public CitationRatePipeline getAnalysisPipeline() {
        return analysisPipeline;
    }

    public TuningPipeline getTuningPipeline() {
        return tuningPipeline;
    }

    public JsonDocumentStore getDocumentStore() {
        return documentStore;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public RateModelConfig getConfig() {
        return config;
    }

    /**
     * Writes the Prometheus scrape output when metrics are enabled and an output path is configured.
     */
    public void exportMetrics() throws IOException {
        RateModelConfig.MetricsConfig metrics = config.getMetrics();
        if (metrics.isEnabled() && metrics.getOutputPath() != null && !metrics.getOutputPath().isBlank()) {
            metricsRegistry.writeTo(Path.of(metrics.getOutputPath()));
        }
    }

    @Override
    public void close() {
        log.info("Shutting down CitationRateFactory...");

        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("CitationRateFactory shut down");
    }
}
