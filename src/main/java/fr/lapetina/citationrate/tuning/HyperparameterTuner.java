package fr.lapetina.citationrate.tuning;

import fr.lapetina.citationrate.domain.exception.NumericalDefectException;
import fr.lapetina.citationrate.domain.model.HyperparameterGridResult;
import fr.lapetina.citationrate.domain.model.PreparedSeries;
import fr.lapetina.citationrate.domain.noise.NoiseModel;
import fr.lapetina.citationrate.statespace.LocalLevelFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.IntConsumer;

/**
 * Grid search over (process variance, overdispersion) by total marginal likelihood.
 *
 * <p>Each grid cell is a pure function of the corpus: the sum, over every series with at
 * least {@code minObservations} steps, of the filter log-likelihood with the time-varying
 * observation variance for that overdispersion. Cells are evaluated independently on the
 * supplied executor and reassembled by grid index.
 *
 * <p>The best pair is chosen by a row-major scan (process variance outer, overdispersion
 * inner) keeping the first maximum, so ties resolve the same way on every run.
 *
 * <p>A series whose evaluation hits a {@link NumericalDefectException} is left out of that
 * cell's sum and reported in the result by its corpus position; the rest of the corpus is
 * still scored.
 */
public final class HyperparameterTuner {

    private static final Logger log = LoggerFactory.getLogger(HyperparameterTuner.class);

    /** Fewer steps than this carry no information about the temporal dynamics. */
    public static final int DEFAULT_MIN_OBSERVATIONS = 2;

    private final double minCount;
    private final double sigmaMinSq;
    private final int minObservations;
    private final HyperparameterGrid grid;
    private final Executor executor;
    private final IntConsumer progress;

    private HyperparameterTuner(Builder builder) {
        this.minCount = builder.minCount;
        this.sigmaMinSq = builder.sigmaMinSq;
        this.minObservations = builder.minObservations;
        this.grid = builder.grid;
        this.executor = builder.executor;
        this.progress = builder.progress;
    }

    /**
     * Scores every cell of an {@code gridSize x gridSize} grid and returns the maximizing pair.
     */
    public HyperparameterGridResult tune(List<PreparedSeries> corpus, int gridSize) {
        double[] processVariances = grid.processVarianceCandidates(gridSize);
        double[] overdispersions = grid.overdispersionCandidates(gridSize);
        int eligible = countEligible(corpus);

        log.info("Running grid search over {}x{} = {} parameter combinations on {} series",
                gridSize, gridSize, gridSize * gridSize, eligible);

        List<CompletableFuture<CellScore>> cells = new ArrayList<>(gridSize * gridSize);
        for (double q : processVariances) {
            for (double phi : overdispersions) {
                cells.add(CompletableFuture.supplyAsync(() -> scoreCell(corpus, q, phi), executor));
            }
        }

        double[][] scores = new double[gridSize][gridSize];
        SortedMap<Integer, String> failedSeries = new TreeMap<>();
        double bestLogLikelihood = Double.NEGATIVE_INFINITY;
        double bestProcessVariance = processVariances[0];
        double bestOverdispersion = overdispersions[0];

        for (int i = 0; i < gridSize; i++) {
            for (int j = 0; j < gridSize; j++) {
                CellScore cell = join(cells.get(i * gridSize + j));
                scores[i][j] = cell.logLikelihood();
                for (int position : cell.failedPositions()) {
                    failedSeries.put(position, corpus.get(position).seriesId());
                }

                if (cell.logLikelihood() > bestLogLikelihood) {
                    bestLogLikelihood = cell.logLikelihood();
                    bestProcessVariance = processVariances[i];
                    bestOverdispersion = overdispersions[j];
                }
            }
            progress.accept(i + 1);
            if ((i + 1) % 10 == 0) {
                log.info("Completed {}/{} rows", i + 1, gridSize);
            }
        }

        if (!failedSeries.isEmpty()) {
            log.warn("{} series failed during grid evaluation and were left out of the affected cells: {}",
                    failedSeries.size(), failedSeries.values());
        }
        log.info("Optimal hyperparameters: processVar={}, overdispersion={}, logLikelihood={}",
                bestProcessVariance, bestOverdispersion, bestLogLikelihood);

        return new HyperparameterGridResult(processVariances, overdispersions, scores,
                bestProcessVariance, bestOverdispersion, bestLogLikelihood, eligible, failedSeries);
    }

    /**
     * Total log-likelihood of the corpus for one (process variance, overdispersion) pair.
     */
    public CellScore scoreCell(List<PreparedSeries> corpus, double processVariance, double overdispersion) {
        LocalLevelFilter filter = new LocalLevelFilter(processVariance);
        double total = 0.0;
        List<Integer> failed = null;

        for (int position = 0; position < corpus.size(); position++) {
            PreparedSeries series = corpus.get(position);
            if (series.length() < minObservations) {
                continue;
            }
            double[] variances = NoiseModel.variances(series.empiricalRate(), overdispersion, minCount, sigmaMinSq);
            try {
                total += filter.logLikelihood(series.seriesId(), series.observations(), variances);
            } catch (NumericalDefectException e) {
                log.debug("Skipping series in cell q={}, phi={}: {}", processVariance, overdispersion, e.getMessage());
                if (failed == null) {
                    failed = new ArrayList<>();
                }
                failed.add(position);
            }
        }
        return new CellScore(total, failed != null ? failed : Collections.emptyList());
    }

    /**
     * Number of series long enough to take part in the likelihood.
     */
    public int countEligible(List<PreparedSeries> corpus) {
        return (int) corpus.stream()
                .filter(series -> series.length() >= minObservations)
                .count();
    }

    public int getMinObservations() {
        return minObservations;
    }

    private static CellScore join(CompletableFuture<CellScore> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Score of one grid cell.
     *
     * @param logLikelihood   summed log-likelihood of the contributing series
     * @param failedPositions corpus positions of series left out because of a numerical defect
     */
    public record CellScore(double logLikelihood, List<Integer> failedPositions) {
        public CellScore {
            failedPositions = List.copyOf(failedPositions);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double minCount = 0.5;
        private double sigmaMinSq = NoiseModel.DEFAULT_SIGMA_MIN_SQ;
        private int minObservations = DEFAULT_MIN_OBSERVATIONS;
        private HyperparameterGrid grid = HyperparameterGrid.defaults();
        private Executor executor = Runnable::run;
        private IntConsumer progress = completedRows -> { };

        public Builder minCount(double minCount) {
            this.minCount = minCount;
            return this;
        }

        public Builder sigmaMinSq(double sigmaMinSq) {
            this.sigmaMinSq = sigmaMinSq;
            return this;
        }

        public Builder minObservations(int minObservations) {
            this.minObservations = minObservations;
            return this;
        }

        public Builder grid(HyperparameterGrid grid) {
            this.grid = grid;
            return this;
        }

        /**
         * Executor running the cell evaluations. Defaults to the calling thread.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Callback receiving the number of completed grid rows.
         */
        public Builder progress(IntConsumer progress) {
            this.progress = progress;
            return this;
        }

        public HyperparameterTuner build() {
            if (!(minCount > 0.0)) {
                throw new IllegalArgumentException("Pseudocount must be > 0, got " + minCount);
            }
            if (minObservations < 1) {
                throw new IllegalArgumentException("Minimum observations must be >= 1, got " + minObservations);
            }
            return new HyperparameterTuner(this);
        }
    }
}
