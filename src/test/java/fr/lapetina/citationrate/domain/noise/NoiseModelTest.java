package fr.lapetina.citationrate.domain.noise;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NoiseModelTest {

    @Nested
    @DisplayName("NoiseModel")
    class NoiseModelVariance {

        @Test
        @DisplayName("should combine Poisson variance, overdispersion and floor")
        void shouldCombineTerms() {
            double variance = NoiseModel.variance(4.5, 0.5, 0.5, 0.01);

            assertThat(variance).isCloseTo(0.5 / 5.0 + 0.01, within(1e-12));
        }

        @Test
        @DisplayName("should return only the floor when overdispersion is zero")
        void shouldReturnFloorWithoutOverdispersion() {
            assertThat(NoiseModel.variance(10.0, 0.0, 0.5, 0.01)).isEqualTo(0.01);
        }

        @Test
        @DisplayName("should decrease as the rate grows")
        void shouldDecreaseWithRate() {
            double low = NoiseModel.variance(1.0, 1.0, 0.5, 0.01);
            double high = NoiseModel.variance(100.0, 1.0, 0.5, 0.01);

            assertThat(high).isLessThan(low);
        }

        @Test
        @DisplayName("should compute element-wise variances")
        void shouldComputeElementWise() {
            double[] variances = NoiseModel.variances(new double[]{0.0, 1.5, 9.5}, 2.0, 0.5,
                    NoiseModel.DEFAULT_SIGMA_MIN_SQ);

            assertThat(variances).hasSize(3);
            assertThat(variances[0]).isCloseTo(4.01, within(1e-12));
            assertThat(variances[1]).isCloseTo(1.01, within(1e-12));
            assertThat(variances[2]).isCloseTo(0.21, within(1e-12));
        }

        @Test
        @DisplayName("should return an empty array for an empty series")
        void shouldHandleEmptySeries() {
            assertThat(NoiseModel.variances(new double[0], 1.0, 0.5, 0.01)).isEmpty();
        }
    }

    @Nested
    @DisplayName("ObservationVarianceMode")
    class Modes {

        @Test
        @DisplayName("should prefer a constant variance over overdispersion")
        void shouldPreferConstant() {
            ObservationVarianceMode mode = ObservationVarianceMode.resolve(0.4, 0.56, 0.01);

            assertThat(mode).isEqualTo(new ObservationVarianceMode.Constant(0.4));
            assertThat(mode.getName()).isEqualTo("obs_var");
        }

        @Test
        @DisplayName("should resolve the time-varying mode from overdispersion")
        void shouldResolveTimeVarying() {
            ObservationVarianceMode mode = ObservationVarianceMode.resolve(null, 0.56, 0.02);

            assertThat(mode).isEqualTo(new ObservationVarianceMode.TimeVarying(0.56, 0.02));
            assertThat(mode.getName()).isEqualTo("obs_overdispersion");
        }

        @Test
        @DisplayName("should fall back to the default constant variance")
        void shouldFallBackToDefault() {
            ObservationVarianceMode mode = ObservationVarianceMode.resolve(null, null, 0.01);

            assertThat(mode).isEqualTo(new ObservationVarianceMode.Constant(
                    ObservationVarianceMode.DEFAULT_CONSTANT_VARIANCE));
        }

        @Test
        @DisplayName("should fill a constant variance sequence")
        void shouldFillConstant() {
            ObservationVarianceMode mode = new ObservationVarianceMode.Constant(0.3);

            assertThat(mode.variances(new double[]{0.0, 3.0, 5.0}, 0.5)).containsExactly(0.3, 0.3, 0.3);
            assertThat(mode.varianceAt(100.0, 0.5)).isEqualTo(0.3);
        }

        @Test
        @DisplayName("should delegate the time-varying sequence to the noise model")
        void shouldDelegateTimeVarying() {
            ObservationVarianceMode mode = new ObservationVarianceMode.TimeVarying(0.56);
            double[] rates = {0.0, 3.0, 5.0};

            assertThat(mode.variances(rates, 0.5))
                    .containsExactly(NoiseModel.variances(rates, 0.56, 0.5, NoiseModel.DEFAULT_SIGMA_MIN_SQ));
        }

        @Test
        @DisplayName("should replace only the floor")
        void shouldReplaceFloor() {
            ObservationVarianceMode.TimeVarying mode = new ObservationVarianceMode.TimeVarying(0.56);

            assertThat(mode.withFloor(0.0)).isEqualTo(new ObservationVarianceMode.TimeVarying(0.56, 0.0));
        }
    }
}
