package fr.lapetina.citationrate.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from an arbitrary input stream
 * - Validation of the loaded values
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Configuration file looked up when no path is given. */
    public static final String DEFAULT_CONFIG = "citation-rates.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(RateModelConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails or the values are inconsistent
     */
    public RateModelConfig load() {
        RateModelConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private RateModelConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private RateModelConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public RateModelConfig loadFromStream(InputStream inputStream) {
        RateModelConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private RateModelConfig parse(InputStream inputStream, String source) {
        try {
            RateModelConfig config = yaml.load(inputStream);
            // An empty document means "all defaults"
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Rejects values that no run could use.
     */
    public static void validate(RateModelConfig config) {
        RateModelConfig.ModelConfig model = config.getModel();
        if (model.getProcessVar() < 0.0) {
            throw new ConfigurationException("model.processVar must be >= 0, got " + model.getProcessVar());
        }
        if (model.getObsVar() != null && !(model.getObsVar() > 0.0)) {
            throw new ConfigurationException("model.obsVar must be > 0, got " + model.getObsVar());
        }
        if (model.getObsOverdispersion() != null && model.getObsOverdispersion() < 0.0) {
            throw new ConfigurationException("model.obsOverdispersion must be >= 0, got " + model.getObsOverdispersion());
        }
        if (!(model.getMinCount() > 0.0)) {
            throw new ConfigurationException("model.minCount must be > 0, got " + model.getMinCount());
        }
        if (model.getSigmaMinSq() < 0.0) {
            throw new ConfigurationException("model.sigmaMinSq must be >= 0, got " + model.getSigmaMinSq());
        }
        if (!(model.getInitialVariance() >= 0.0) || Double.isInfinite(model.getInitialVariance())) {
            throw new ConfigurationException("model.initialVariance must be finite and >= 0, got "
                    + model.getInitialVariance());
        }
        if (model.getInitialVariance() == 0.0 && model.getProcessVar() == 0.0) {
            throw new ConfigurationException("model.initialVariance and model.processVar cannot both be 0");
        }
        if (!(config.getForecast().getNoiseFloor() >= 0.0) || Double.isInfinite(config.getForecast().getNoiseFloor())) {
            throw new ConfigurationException("forecast.noiseFloor must be finite and >= 0, got "
                    + config.getForecast().getNoiseFloor());
        }
        if (config.getForecast().getYears() < 0) {
            throw new ConfigurationException("forecast.years must be >= 0, got " + config.getForecast().getYears());
        }
        if (config.getTuning().getGridSize() < 1) {
            throw new ConfigurationException("tuning.gridSize must be >= 1, got " + config.getTuning().getGridSize());
        }
        RateModelConfig.TuningConfig tuning = config.getTuning();
        if (!(tuning.getLogProcessVarMin() <= tuning.getLogProcessVarMax())) {
            throw new ConfigurationException("tuning.logProcessVarMin must be <= tuning.logProcessVarMax, got "
                    + tuning.getLogProcessVarMin() + " > " + tuning.getLogProcessVarMax());
        }
        if (!(tuning.getLogOverdispersionMin() <= tuning.getLogOverdispersionMax())) {
            throw new ConfigurationException("tuning.logOverdispersionMin must be <= tuning.logOverdispersionMax, got "
                    + tuning.getLogOverdispersionMin() + " > " + tuning.getLogOverdispersionMax());
        }
        if (config.getTuning().getMinObservations() < 1) {
            throw new ConfigurationException("tuning.minObservations must be >= 1, got "
                    + config.getTuning().getMinObservations());
        }
    }

    /**
     * Creates a default configuration.
     */
    public static RateModelConfig createDefault() {
        return new RateModelConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
