package fr.lapetina.citationrate.pipeline;

import fr.lapetina.citationrate.domain.exception.InvalidInputException;
import fr.lapetina.citationrate.domain.model.FailureType;
import fr.lapetina.citationrate.domain.model.HyperparameterGridResult;
import fr.lapetina.citationrate.domain.model.PaperRecord;
import fr.lapetina.citationrate.domain.model.PreparedSeries;
import fr.lapetina.citationrate.domain.model.SeriesFailure;
import fr.lapetina.citationrate.domain.model.TuningRun;
import fr.lapetina.citationrate.infrastructure.config.RateModelConfig;
import fr.lapetina.citationrate.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.citationrate.prepare.CaptureTimestamps;
import fr.lapetina.citationrate.prepare.SeriesPreparer;
import fr.lapetina.citationrate.tuning.HyperparameterTuner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Prepares a corpus and runs the hyperparameter grid search over it.
 */
public final class TuningPipeline {

    private static final Logger log = LoggerFactory.getLogger(TuningPipeline.class);

    private final SeriesPreparer preparer;
    private final HyperparameterTuner tuner;
    private final MetricsRegistry metricsRegistry;
    private final int gridSize;

    public TuningPipeline(RateModelConfig config, Executor executor, MetricsRegistry metricsRegistry) {
        RateModelConfig.ModelConfig model = config.getModel();
        RateModelConfig.TuningConfig tuning = config.getTuning();

        this.preparer = new SeriesPreparer(model.getMinCount());
        this.metricsRegistry = metricsRegistry;
        this.gridSize = tuning.getGridSize();
        this.tuner = HyperparameterTuner.builder()
                .minCount(model.getMinCount())
                .sigmaMinSq(model.getSigmaMinSq())
                .minObservations(tuning.getMinObservations())
                .grid(tuning.toGrid())
                .executor(executor)
                .progress(rows -> {
                    metricsRegistry.setCompletedGridRows(rows);
                    metricsRegistry.incrementGridCells(gridSize);
                })
                .build();
    }

    /**
     * Prepares every paper and tunes on the ones that were accepted.
     *
     * @throws InvalidInputException if the capture timestamp is missing or unparsable
     */
    public TuningRun tune(List<PaperRecord> papers, String scrapedAt) {
        OffsetDateTime capturedAt = CaptureTimestamps.parse(scrapedAt);

        long start = System.nanoTime();
        List<PreparedSeries> corpus = new ArrayList<>(papers.size());
        List<Integer> paperIndices = new ArrayList<>(papers.size());
        List<SeriesFailure> failures = new ArrayList<>();
        for (int i = 0; i < papers.size(); i++) {
            PaperRecord paper = papers.get(i);
            if (!paper.hasCitations()) {
                continue;
            }
            try {
                corpus.add(preparer.prepare(paper, capturedAt));
                paperIndices.add(i);
            } catch (InvalidInputException e) {
                String label = paper.title() != null ? paper.title() : "paper[" + i + "]";
                log.warn("Paper {} '{}' rejected: {}", i, label, e.getMessage());
                metricsRegistry.incrementFailureCount(FailureType.INPUT_SHAPE);
                failures.add(new SeriesFailure(i, label, FailureType.INPUT_SHAPE, e.getMessage()));
            }
        }
        metricsRegistry.recordStageLatency("prepare", Duration.ofNanos(System.nanoTime() - start));

        int papersWithData = corpus.size() + failures.size();
        log.info("Loaded {} papers with citation data, {} with at least {} years",
                papersWithData, tuner.countEligible(corpus), tuner.getMinObservations());

        start = System.nanoTime();
        HyperparameterGridResult result = tuner.tune(corpus, gridSize);
        metricsRegistry.recordStageLatency("tune", Duration.ofNanos(System.nanoTime() - start));

        List<Integer> defective = result.getFailedSeriesIndices();
        for (int position : defective) {
            metricsRegistry.incrementFailureCount(FailureType.NUMERICAL_DEFECT);
            failures.add(new SeriesFailure(paperIndices.get(position), corpus.get(position).seriesId(),
                    FailureType.NUMERICAL_DEFECT, "Left out of grid cells after a numerical defect"));
        }
        failures.sort(Comparator.comparingInt(SeriesFailure::index));

        return new TuningRun(papersWithData, failures, result);
    }

    public int getGridSize() {
        return gridSize;
    }
}
