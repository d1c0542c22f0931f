package fr.lapetina.citationrate.pipeline;

import fr.lapetina.citationrate.domain.exception.InvalidInputException;
import fr.lapetina.citationrate.domain.exception.ModelConfigurationException;
import fr.lapetina.citationrate.domain.model.AnalysisRun;
import fr.lapetina.citationrate.domain.model.FailureType;
import fr.lapetina.citationrate.domain.model.HIndexPoint;
import fr.lapetina.citationrate.domain.model.PaperAnalysis;
import fr.lapetina.citationrate.domain.model.PaperRecord;
import fr.lapetina.citationrate.domain.model.SeriesFailure;
import fr.lapetina.citationrate.domain.noise.ObservationVarianceMode;
import fr.lapetina.citationrate.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CitationRatePipelineTest {

    private static final String SCRAPED_AT = "2022-07-02T00:00:00Z";

    private ExecutorService executor;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3, new WorkerThreadFactory("test-worker"));
        metrics = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        metrics.close();
    }

    private CitationRatePipeline.Builder pipeline() {
        return CitationRatePipeline.builder()
                .processVariance(0.25)
                .varianceMode(new ObservationVarianceMode.Constant(0.3))
                .minCount(0.5)
                .executor(executor)
                .metricsRegistry(metrics);
    }

    @Nested
    @DisplayName("Analysis")
    class Analysis {

        @Test
        @DisplayName("should smooth a three-year paper")
        void shouldSmoothPaper() {
            PaperRecord paper = new PaperRecord("Paper A", 8, Map.of("2019", 0, "2020", 3, "2021", 5));

            AnalysisRun run = pipeline().build().analyze(List.of(paper), SCRAPED_AT);

            assertThat(run.failures()).isEmpty();
            PaperAnalysis analysis = run.papers().get(0);
            assertThat(analysis.series().years()).containsExactly(2019, 2020, 2021);
            assertThat(analysis.smoothedLogRate()).hasSize(3);
            assertThat(analysis.smoothed().finalMean()).isCloseTo(1.2149043676400582, within(1e-9));
            assertThat(analysis.smoothedRate()[2]).isCloseTo(Math.exp(1.2149043676400582), within(1e-9));
            assertThat(analysis.smoothedRateStd()[2])
                    .isCloseTo(Math.exp(1.2149043676400582) * Math.sqrt(0.17750586657727116), within(1e-9));
            assertThat(analysis.warnings()).isEmpty();
            assertThat(analysis.hasForecast()).isFalse();
        }

        @Test
        @DisplayName("should return an empty result without forecast for a paper without citations")
        void shouldReturnEmptyResultForEmptyPaper() {
            PaperRecord paper = PaperRecord.of("Workshop Abstract", Map.of());

            AnalysisRun run = pipeline().forecastYears(3).seed(1L).build().analyze(List.of(paper), SCRAPED_AT);

            PaperAnalysis analysis = run.papers().get(0);
            assertThat(analysis.isEmpty()).isTrue();
            assertThat(analysis.series().years()).isEmpty();
            assertThat(analysis.smoothedRate()).isEmpty();
            assertThat(analysis.smoothedRateStd()).isEmpty();
            assertThat(analysis.hasForecast()).isFalse();
        }

        @Test
        @DisplayName("should forecast past the last observed year")
        void shouldForecast() {
            PaperRecord paper = PaperRecord.of("Paper A", Map.of("2019", 0, "2020", 3, "2021", 5));

            AnalysisRun run = pipeline().forecastYears(3).seed(11L).build().analyze(List.of(paper), SCRAPED_AT);

            PaperAnalysis analysis = run.papers().get(0);
            assertThat(analysis.forecast().years()).containsExactly(2022, 2023, 2024);
            assertThat(analysis.forecast().rateMedians())
                    .allSatisfy(median -> assertThat(median).isCloseTo(analysis.smoothedRate()[2], within(1e-12)));
        }

        @Test
        @DisplayName("should reproduce forecasts for a fixed seed regardless of scheduling")
        void shouldReproduceSeededForecasts() {
            List<PaperRecord> papers = List.of(
                    PaperRecord.of("A", Map.of("2019", 0, "2020", 3, "2021", 5)),
                    PaperRecord.of("B", Map.of("2020", 10, "2021", 20)),
                    PaperRecord.of("C", Map.of("2018", 1, "2019", 1, "2020", 2)));

            AnalysisRun parallel = pipeline().forecastYears(2).seed(5L).build().analyze(papers, SCRAPED_AT);
            AnalysisRun sequential = pipeline().executor(Runnable::run).forecastYears(2).seed(5L).build()
                    .analyze(papers, SCRAPED_AT);

            for (int i = 0; i < papers.size(); i++) {
                assertThat(parallel.papers().get(i).forecast()).isEqualTo(sequential.papers().get(i).forecast());
            }
        }

        @Test
        @DisplayName("should keep the input order")
        void shouldKeepInputOrder() {
            List<PaperRecord> papers = List.of(
                    PaperRecord.of("First", Map.of("2020", 1)),
                    PaperRecord.of("Second", Map.of("2020", 2)),
                    PaperRecord.of("Third", Map.of("2020", 3)),
                    PaperRecord.of("Fourth", Map.of("2020", 4)));

            AnalysisRun run = pipeline().build().analyze(papers, SCRAPED_AT);

            assertThat(run.papers()).extracting(PaperAnalysis::title)
                    .containsExactly("First", "Second", "Third", "Fourth");
            assertThat(run.papers()).extracting(PaperAnalysis::index).containsExactly(0, 1, 2, 3);
        }

        @Test
        @DisplayName("should use the time-varying variance from the empirical rates")
        void shouldUseTimeVaryingVariance() {
            PaperRecord paper = PaperRecord.of("Paper A", Map.of("2019", 0, "2020", 3, "2021", 5));

            AnalysisRun constant = pipeline().build().analyze(List.of(paper), SCRAPED_AT);
            AnalysisRun timeVarying = pipeline().varianceMode(new ObservationVarianceMode.TimeVarying(0.56)).build()
                    .analyze(List.of(paper), SCRAPED_AT);

            assertThat(timeVarying.papers().get(0).smoothedLogRate())
                    .isNotEqualTo(constant.papers().get(0).smoothedLogRate());
        }
    }

    @Nested
    @DisplayName("Warnings and failures")
    class WarningsAndFailures {

        @Test
        @DisplayName("should warn when yearly counts disagree with the reported total")
        void shouldWarnOnInconsistentTotal() {
            PaperRecord paper = new PaperRecord("Mismatch", 20, Map.of("2020", 3, "2021", 5));

            AnalysisRun run = pipeline().build().analyze(List.of(paper), SCRAPED_AT);

            assertThat(run.failures()).isEmpty();
            assertThat(run.papers().get(0).warnings()).singleElement()
                    .asString().contains("total_citations is 20");
        }

        @Test
        @DisplayName("should not warn when the total is absent")
        void shouldSkipCheckWithoutTotal() {
            PaperRecord paper = PaperRecord.of("No total", Map.of("2020", 3, "2021", 5));

            AnalysisRun run = pipeline().build().analyze(List.of(paper), SCRAPED_AT);

            assertThat(run.papers().get(0).warnings()).isEmpty();
        }

        @Test
        @DisplayName("should record a malformed paper and analyse the rest")
        void shouldIsolateMalformedPaper() {
            List<PaperRecord> papers = List.of(
                    PaperRecord.of("Good", Map.of("2020", 3, "2021", 5)),
                    PaperRecord.of("Bad", Map.of("20x1", 5)),
                    PaperRecord.of(null, Map.of("2020", 1)),
                    PaperRecord.of("Also good", Map.of("2021", 2)));

            AnalysisRun run = pipeline().build().analyze(papers, SCRAPED_AT);

            assertThat(run.papers()).extracting(PaperAnalysis::title).containsExactly("Good", "Also good");
            assertThat(run.failures()).extracting(SeriesFailure::index).containsExactly(1, 2);
            assertThat(run.failures()).extracting(SeriesFailure::seriesId).containsExactly("Bad", "paper[2]");
            assertThat(run.failures()).extracting(SeriesFailure::type).containsOnly(FailureType.INPUT_SHAPE);
            assertThat(metrics.scrape()).contains("test_series_failures_total");
        }

        @Test
        @DisplayName("should abort the run on an unparsable capture timestamp")
        void shouldAbortOnBadTimestamp() {
            CitationRatePipeline pipeline = pipeline().build();
            List<PaperRecord> papers = List.of(PaperRecord.of("Good", Map.of("2020", 3)));

            assertThatThrownBy(() -> pipeline.analyze(papers, "not a date"))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("should reject a negative forecast horizon")
        void shouldRejectNegativeHorizon() {
            assertThatThrownBy(() -> pipeline().forecastYears(-1).build())
                    .isInstanceOf(ModelConfigurationException.class);
        }

        @Test
        @DisplayName("should reject zero initial and process variance before any paper is analysed")
        void shouldRejectDegenerateVariances() {
            assertThatThrownBy(() -> pipeline().processVariance(0.0).initialVariance(0.0).build())
                    .isInstanceOf(ModelConfigurationException.class)
                    .hasMessageContaining("both be zero");
        }

        @Test
        @DisplayName("should analyse with a zero initial variance when the process variance is positive")
        void shouldAcceptZeroInitialVarianceWithProcessNoise() {
            PaperRecord paper = PaperRecord.of("Paper A", Map.of("2020", 1, "2021", 2));

            AnalysisRun run = pipeline().initialVariance(0.0).build().analyze(List.of(paper), SCRAPED_AT);

            assertThat(run.failures()).isEmpty();
            assertThat(run.papers()).hasSize(1);
        }

        @Test
        @DisplayName("should reject a negative forecast noise floor")
        void shouldRejectNegativeNoiseFloor() {
            assertThatThrownBy(() -> pipeline().noiseFloor(-0.01).build())
                    .isInstanceOf(ModelConfigurationException.class);
        }
    }

    @Test
    @DisplayName("should project the h-index of the analysed papers")
    void shouldProjectHIndex() {
        List<PaperRecord> papers = List.of(
                PaperRecord.of("A", Map.of("2020", 5, "2021", 5)),
                PaperRecord.of("B", Map.of("2020", 5, "2021", 5)));

        AnalysisRun run = pipeline().forecastYears(1).seed(3L).build().analyze(papers, SCRAPED_AT);

        assertThat(run.hIndex()).extracting(HIndexPoint::year).containsExactly(2020, 2021, 2022);
        assertThat(run.hIndex().get(2).forecast()).isTrue();
        assertThat(run.hIndex().get(0).hIndex()).isEqualTo(2);
    }
}
