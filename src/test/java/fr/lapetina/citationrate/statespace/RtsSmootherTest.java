package fr.lapetina.citationrate.statespace;

import fr.lapetina.citationrate.domain.exception.NumericalDefectException;
import fr.lapetina.citationrate.domain.model.FilterResult;
import fr.lapetina.citationrate.domain.model.SmoothResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RtsSmootherTest {

    private final LocalLevelFilter filter = new LocalLevelFilter(0.25);
    private final RtsSmoother smoother = new RtsSmoother();

    @Test
    @DisplayName("should return an empty result for an empty filter pass")
    void shouldHandleEmptySeries() {
        SmoothResult result = smoother.smooth("empty", FilterResult.empty());

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should equal the filtered state for a single observation")
    void shouldEqualFilteredForSingleStep() {
        FilterResult filtered = filter.filter("single", new double[]{0.7}, new double[]{0.3});

        SmoothResult smoothed = smoother.smooth("single", filtered);

        assertThat(smoothed.smoothedMean()).containsExactly(filtered.filteredMean());
        assertThat(smoothed.smoothedVariance()).containsExactly(filtered.filteredVariance());
    }

    @Test
    @DisplayName("should keep the terminal state equal to the last filtered state")
    void shouldKeepTerminalState() {
        FilterResult filtered = filter.filter("series",
                new double[]{-0.69, 1.25, 1.70, 2.1}, new double[]{0.3, 0.3, 0.3, 0.3});

        SmoothResult smoothed = smoother.smooth("series", filtered);

        assertThat(smoothed.finalMean()).isEqualTo(filtered.filteredMean(3));
        assertThat(smoothed.finalVariance()).isEqualTo(filtered.filteredVariance(3));
    }

    @Test
    @DisplayName("should never report a smoothed variance above the filtered variance")
    void shouldNotExceedFilteredVariance() {
        double[] z = {0.1, 2.3, 1.7, 2.9, 0.4, 3.3, 2.2};
        double[] r = {0.9, 0.2, 0.4, 0.05, 1.5, 0.3, 0.6};
        FilterResult filtered = filter.filter("mixed", z, r);

        SmoothResult smoothed = smoother.smooth("mixed", filtered);

        for (int t = 0; t < z.length; t++) {
            assertThat(smoothed.smoothedVariance(t))
                    .isGreaterThanOrEqualTo(0.0)
                    .isLessThanOrEqualTo(filtered.filteredVariance(t) + 1e-12);
        }
    }

    @Test
    @DisplayName("should pull early estimates toward later observations")
    void shouldUseFutureInformation() {
        FilterResult filtered = filter.filter("rising",
                new double[]{0.0, 2.0, 2.0, 2.0}, new double[]{0.3, 0.3, 0.3, 0.3});

        SmoothResult smoothed = smoother.smooth("rising", filtered);

        assertThat(smoothed.smoothedMean(0)).isGreaterThan(filtered.filteredMean(0));
        assertThat(smoothed.smoothedMean(0)).isLessThan(2.0);
    }

    @Test
    @DisplayName("should not modify the filter result")
    void shouldNotModifyFilterResult() {
        FilterResult filtered = filter.filter("series", new double[]{0.0, 2.0, 1.0}, new double[]{0.3, 0.3, 0.3});
        double[] before = filtered.filteredMean();

        smoother.smooth("series", filtered);

        assertThat(filtered.filteredMean()).containsExactly(before, within(0.0));
    }

    @Test
    @DisplayName("should report a zero predicted variance as a numerical defect")
    void shouldReportZeroPredictedVariance() {
        FilterResult degenerate = new FilterResult(
                new double[]{1.0, 1.0},
                new double[]{0.0, 0.0},
                new double[]{1.0, 1.0},
                new double[]{0.0, 0.0},
                0.0);

        assertThatThrownBy(() -> smoother.smooth("degenerate", degenerate))
                .isInstanceOfSatisfying(NumericalDefectException.class, e -> {
                    assertThat(e.getSeriesId()).isEqualTo("degenerate");
                    assertThat(e.getTimeIndex()).isZero();
                });
    }
}
