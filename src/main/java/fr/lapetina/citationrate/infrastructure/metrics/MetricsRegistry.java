package fr.lapetina.citationrate.infrastructure.metrics;

import fr.lapetina.citationrate.domain.model.FailureType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Paper counters by outcome
 * - Series failure counters by type
 * - Grid cell counter and completed-row gauge for tuning runs
 * - Stage latency timers
 * - Prometheus exposition, optionally written to a file at the end of a run
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> paperCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    private final Counter gridCells;
    private final AtomicInteger completedGridRows = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.gridCells = Counter.builder(prefix + "_grid_cells_evaluated_total")
                .description("Hyperparameter grid cells evaluated")
                .register(registry);

        Gauge.builder(prefix + "_grid_rows_completed", completedGridRows, AtomicInteger::get)
                .description("Grid rows completed in the current tuning run")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("citation_rates");
    }

    /**
     * Increments the paper counter for an outcome (analyzed, empty, failed).
     */
    public void incrementPaperCount(String outcome) {
        paperCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_papers_total")
                        .description("Papers processed")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the failure counter for a failure type.
     */
    public void incrementFailureCount(FailureType type) {
        failureCounters.computeIfAbsent(type.name(), k ->
                Counter.builder(prefix + "_series_failures_total")
                        .description("Per-series failures")
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (prepare, filter, smooth, forecast, tune).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void incrementGridCells(long cells) {
        gridCells.increment(cells);
    }

    public void setCompletedGridRows(int rows) {
        completedGridRows.set(rows);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Writes the Prometheus scrape output to a file.
     */
    public void writeTo(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, scrape(), StandardCharsets.UTF_8);
        log.info("Metrics written to {}", path);
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
