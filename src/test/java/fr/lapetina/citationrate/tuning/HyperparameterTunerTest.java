package fr.lapetina.citationrate.tuning;

import fr.lapetina.citationrate.domain.model.HyperparameterGridResult;
import fr.lapetina.citationrate.domain.model.PaperRecord;
import fr.lapetina.citationrate.domain.model.PreparedSeries;
import fr.lapetina.citationrate.domain.noise.NoiseModel;
import fr.lapetina.citationrate.prepare.CaptureTimestamps;
import fr.lapetina.citationrate.prepare.SeriesPreparer;
import fr.lapetina.citationrate.statespace.LocalLevelFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HyperparameterTunerTest {

    private static final OffsetDateTime CAPTURED_AT = CaptureTimestamps.parse("2024-07-01T00:00:00Z");

    private final SeriesPreparer preparer = new SeriesPreparer(0.5);

    private List<PreparedSeries> corpus() {
        return List.of(
                preparer.prepare(PaperRecord.of("A", Map.of("2019", 0, "2020", 3, "2021", 5)), CAPTURED_AT),
                preparer.prepare(PaperRecord.of("B", Map.of("2018", 4, "2019", 9, "2020", 14, "2021", 11,
                        "2022", 12, "2023", 7)), CAPTURED_AT),
                preparer.prepare(PaperRecord.of("C", Map.of("2021", 1, "2022", 2, "2023", 1, "2024", 1)), CAPTURED_AT),
                preparer.prepare(PaperRecord.of("Single", Map.of("2023", 3)), CAPTURED_AT)
        );
    }

    private static PreparedSeries defective(String seriesId) {
        return new PreparedSeries(seriesId,
                new int[]{2020, 2021},
                new double[]{1.0, 2.0},
                new double[]{1.0, 1.0},
                new double[]{1.0, 2.0},
                new double[]{0.4, Double.POSITIVE_INFINITY});
    }

    @Nested
    @DisplayName("Grid")
    class Grid {

        @Test
        @DisplayName("should span the default log ranges")
        void shouldSpanDefaultRanges() {
            HyperparameterGrid grid = HyperparameterGrid.defaults();

            double[] q = grid.processVarianceCandidates(5);
            double[] phi = grid.overdispersionCandidates(5);

            assertThat(q[0]).isCloseTo(Math.exp(-3.0), within(1e-12));
            assertThat(q[2]).isCloseTo(Math.exp(-1.0), within(1e-12));
            assertThat(q[4]).isCloseTo(Math.exp(1.0), within(1e-12));
            assertThat(phi[0]).isCloseTo(Math.exp(-1.0), within(1e-12));
            assertThat(phi[4]).isCloseTo(Math.exp(2.0), within(1e-12));
        }

        @Test
        @DisplayName("should place a single candidate at the lower bound")
        void shouldPlaceSingleCandidateAtLowerBound() {
            assertThat(HyperparameterGrid.logUniform(-3.0, 1.0, 1)).containsExactly(Math.exp(-3.0));
        }

        @Test
        @DisplayName("should reject an empty grid")
        void shouldRejectEmptyGrid() {
            assertThatThrownBy(() -> HyperparameterGrid.logUniform(-3.0, 1.0, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Search")
    class Search {

        @Test
        @DisplayName("should evaluate exactly the single pair of a one-point grid")
        void shouldEvaluateSinglePair() {
            HyperparameterTuner tuner = HyperparameterTuner.builder().build();

            HyperparameterGridResult result = tuner.tune(corpus(), 1);

            assertThat(result.getGridSize()).isEqualTo(1);
            assertThat(result.getEvaluatedCells()).isEqualTo(1);
            assertThat(result.getBestProcessVariance()).isEqualTo(Math.exp(-3.0));
            assertThat(result.getBestOverdispersion()).isEqualTo(Math.exp(-1.0));
            assertThat(result.getBestLogLikelihood()).isEqualTo(result.score(0, 0));
        }

        @Test
        @DisplayName("should sum the filter likelihood of series with at least two years")
        void shouldSumEligibleLikelihoods() {
            HyperparameterTuner tuner = HyperparameterTuner.builder().build();
            List<PreparedSeries> corpus = corpus();
            LocalLevelFilter filter = new LocalLevelFilter(0.3);

            double expected = 0.0;
            for (PreparedSeries series : corpus.subList(0, 3)) {
                double[] r = NoiseModel.variances(series.empiricalRate(), 1.2, 0.5, NoiseModel.DEFAULT_SIGMA_MIN_SQ);
                expected += filter.logLikelihood(series.seriesId(), series.observations(), r);
            }

            HyperparameterTuner.CellScore score = tuner.scoreCell(corpus, 0.3, 1.2);

            assertThat(score.logLikelihood()).isCloseTo(expected, within(1e-12));
            assertThat(score.failedPositions()).isEmpty();
            assertThat(tuner.countEligible(corpus)).isEqualTo(3);
        }

        @Test
        @DisplayName("should include single-year series when the threshold is lowered")
        void shouldHonorMinObservations() {
            HyperparameterTuner tuner = HyperparameterTuner.builder().minObservations(1).build();

            assertThat(tuner.countEligible(corpus())).isEqualTo(4);
            assertThat(tuner.tune(corpus(), 2).getContributingSeries()).isEqualTo(4);
        }

        @Test
        @DisplayName("should pick the maximum scored cell")
        void shouldPickMaximum() {
            HyperparameterTuner tuner = HyperparameterTuner.builder().build();

            HyperparameterGridResult result = tuner.tune(corpus(), 6);

            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < 6; i++) {
                for (int j = 0; j < 6; j++) {
                    max = Math.max(max, result.score(i, j));
                }
            }
            assertThat(result.getBestLogLikelihood()).isEqualTo(max);
            assertThat(result.getContributingSeries()).isEqualTo(3);
        }

        @Test
        @DisplayName("should keep the first cell when every score ties")
        void shouldKeepFirstCellOnTies() {
            HyperparameterTuner tuner = HyperparameterTuner.builder().build();

            HyperparameterGridResult result = tuner.tune(List.of(), 3);

            assertThat(result.getBestLogLikelihood()).isZero();
            assertThat(result.getBestProcessVariance()).isEqualTo(result.getProcessVarianceCandidates()[0]);
            assertThat(result.getBestOverdispersion()).isEqualTo(result.getOverdispersionCandidates()[0]);
        }

        @Test
        @DisplayName("should give identical results on repeated runs")
        void shouldBeDeterministic() {
            HyperparameterTuner tuner = HyperparameterTuner.builder().build();

            assertThat(tuner.tune(corpus(), 5)).isEqualTo(tuner.tune(corpus(), 5));
        }

        @Test
        @DisplayName("should give the same grid in parallel as sequentially")
        void shouldMatchSequentialWhenParallel() {
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                HyperparameterGridResult sequential = HyperparameterTuner.builder().build().tune(corpus(), 7);
                HyperparameterGridResult parallel = HyperparameterTuner.builder()
                        .executor(executor)
                        .build()
                        .tune(corpus(), 7);

                assertThat(parallel).isEqualTo(sequential);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should report completed rows")
        void shouldReportProgress() {
            AtomicInteger lastRow = new AtomicInteger();
            HyperparameterTuner tuner = HyperparameterTuner.builder().progress(lastRow::set).build();

            tuner.tune(corpus(), 4);

            assertThat(lastRow.get()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should leave out a defective series and keep scoring the rest")
        void shouldSkipDefectiveSeries() {
            List<PreparedSeries> corpus = new ArrayList<>(corpus());
            corpus.add(defective("Defective"));
            HyperparameterTuner tuner = HyperparameterTuner.builder().build();

            HyperparameterGridResult withDefect = tuner.tune(corpus, 3);
            HyperparameterGridResult clean = tuner.tune(corpus(), 3);

            assertThat(withDefect.getFailedSeries()).containsExactly("Defective");
            assertThat(withDefect.getFailedSeriesIndices()).containsExactly(4);
            assertThat(withDefect.getBestLogLikelihood()).isEqualTo(clean.getBestLogLikelihood());
        }

        @Test
        @DisplayName("should list defective series sharing a title separately and in corpus order")
        void shouldKeepDuplicateTitlesApart() {
            List<PreparedSeries> corpus = new ArrayList<>();
            corpus.add(defective("Same Title"));
            corpus.addAll(corpus());
            corpus.add(defective("Another"));
            corpus.add(defective("Same Title"));
            HyperparameterTuner tuner = HyperparameterTuner.builder().build();

            HyperparameterGridResult result = tuner.tune(corpus, 2);

            assertThat(result.getFailedSeriesIndices()).containsExactly(0, 5, 6);
            assertThat(result.getFailedSeries()).containsExactly("Same Title", "Another", "Same Title");
        }

        @Test
        @DisplayName("should reject a non-positive pseudocount")
        void shouldRejectNonPositivePseudocount() {
            assertThatThrownBy(() -> HyperparameterTuner.builder().minCount(0.0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
