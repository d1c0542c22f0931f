package fr.lapetina.citationrate.infrastructure.config;

import fr.lapetina.citationrate.domain.noise.NoiseModel;
import fr.lapetina.citationrate.domain.noise.ObservationVarianceMode;
import fr.lapetina.citationrate.prepare.SeriesPreparer;
import fr.lapetina.citationrate.statespace.Forecaster;
import fr.lapetina.citationrate.statespace.InitialState;
import fr.lapetina.citationrate.tuning.HyperparameterGrid;
import fr.lapetina.citationrate.tuning.HyperparameterTuner;

/**
 * Root configuration object for citation rate runs.
 * Designed to be populated from YAML.
 */
public class RateModelConfig {

    private ModelConfig model = new ModelConfig();
    private ForecastConfig forecast = new ForecastConfig();
    private TuningConfig tuning = new TuningConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ModelConfig getModel() { return model; }
    public void setModel(ModelConfig model) { this.model = model; }

    public ForecastConfig getForecast() { return forecast; }
    public void setForecast(ForecastConfig forecast) { this.forecast = forecast; }

    public TuningConfig getTuning() { return tuning; }
    public void setTuning(TuningConfig tuning) { this.tuning = tuning; }

    public ExecutionConfig getExecution() { return execution; }
    public void setExecution(ExecutionConfig execution) { this.execution = execution; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * State-space model configuration.
     *
     * <p>{@code obsVar} and {@code obsOverdispersion} are mutually exclusive: a constant
     * observation variance disables the time-varying mode.
     */
    public static class ModelConfig {
        private double processVar = 0.25;
        private Double obsVar;
        private Double obsOverdispersion = 0.56;
        private double minCount = SeriesPreparer.DEFAULT_MIN_COUNT;
        private double sigmaMinSq = NoiseModel.DEFAULT_SIGMA_MIN_SQ;
        private double initialVariance = InitialState.DEFAULT_VARIANCE;

        public double getProcessVar() { return processVar; }
        public void setProcessVar(double processVar) { this.processVar = processVar; }

        public Double getObsVar() { return obsVar; }
        public void setObsVar(Double obsVar) { this.obsVar = obsVar; }

        public Double getObsOverdispersion() { return obsOverdispersion; }
        public void setObsOverdispersion(Double obsOverdispersion) { this.obsOverdispersion = obsOverdispersion; }

        public double getMinCount() { return minCount; }
        public void setMinCount(double minCount) { this.minCount = minCount; }

        public double getSigmaMinSq() { return sigmaMinSq; }
        public void setSigmaMinSq(double sigmaMinSq) { this.sigmaMinSq = sigmaMinSq; }

        public double getInitialVariance() { return initialVariance; }
        public void setInitialVariance(double initialVariance) { this.initialVariance = initialVariance; }

        /**
         * Resolves the observation variance mode for the run.
         */
        public ObservationVarianceMode resolveVarianceMode() {
            return ObservationVarianceMode.resolve(obsVar, obsOverdispersion, sigmaMinSq);
        }
    }

    /**
     * Forecast configuration. A horizon of zero disables forecasting.
     */
    public static class ForecastConfig {
        private int years = 0;
        private Long seed;
        private double noiseFloor = Forecaster.DEFAULT_NOISE_FLOOR;

        public int getYears() { return years; }
        public void setYears(int years) { this.years = years; }

        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }

        public double getNoiseFloor() { return noiseFloor; }
        public void setNoiseFloor(double noiseFloor) { this.noiseFloor = noiseFloor; }
    }

    /**
     * Hyperparameter grid search configuration.
     */
    public static class TuningConfig {
        private int gridSize = HyperparameterGrid.DEFAULT_GRID_SIZE;
        private double logProcessVarMin = -3.0;
        private double logProcessVarMax = 1.0;
        private double logOverdispersionMin = -1.0;
        private double logOverdispersionMax = 2.0;
        private int minObservations = HyperparameterTuner.DEFAULT_MIN_OBSERVATIONS;

        public int getGridSize() { return gridSize; }
        public void setGridSize(int gridSize) { this.gridSize = gridSize; }

        public double getLogProcessVarMin() { return logProcessVarMin; }
        public void setLogProcessVarMin(double logProcessVarMin) { this.logProcessVarMin = logProcessVarMin; }

        public double getLogProcessVarMax() { return logProcessVarMax; }
        public void setLogProcessVarMax(double logProcessVarMax) { this.logProcessVarMax = logProcessVarMax; }

        public double getLogOverdispersionMin() { return logOverdispersionMin; }
        public void setLogOverdispersionMin(double logOverdispersionMin) { this.logOverdispersionMin = logOverdispersionMin; }

        public double getLogOverdispersionMax() { return logOverdispersionMax; }
        public void setLogOverdispersionMax(double logOverdispersionMax) { this.logOverdispersionMax = logOverdispersionMax; }

        public int getMinObservations() { return minObservations; }
        public void setMinObservations(int minObservations) { this.minObservations = minObservations; }

        public HyperparameterGrid toGrid() {
            return new HyperparameterGrid(logProcessVarMin, logProcessVarMax, logOverdispersionMin, logOverdispersionMax);
        }
    }

    /**
     * Worker pool configuration.
     */
    public static class ExecutionConfig {
        private int parallelism = 0;

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }

        /**
         * Configured parallelism, or the number of available processors when zero or negative.
         */
        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "citation_rates";
        private String outputPath;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public String getOutputPath() { return outputPath; }
        public void setOutputPath(String outputPath) { this.outputPath = outputPath; }
    }
}
