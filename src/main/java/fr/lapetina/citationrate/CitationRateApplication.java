package fr.lapetina.citationrate;

import fr.lapetina.citationrate.api.dto.AnalysisDocument;
import fr.lapetina.citationrate.api.dto.CitationsDocument;
import fr.lapetina.citationrate.api.dto.TuningDocument;
import fr.lapetina.citationrate.domain.model.AnalysisRun;
import fr.lapetina.citationrate.domain.model.TuningRun;
import fr.lapetina.citationrate.infrastructure.config.ConfigLoader;
import fr.lapetina.citationrate.infrastructure.config.RateModelConfig;
import fr.lapetina.citationrate.pipeline.CitationRatePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <pre>
 * analyze &lt;input.json&gt; &lt;output.json&gt; [config.yaml]
 * tune    &lt;input.json&gt; &lt;output.json&gt; [config.yaml]
 * </pre>
 */
public class CitationRateApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CitationRateApplication.class);

    private final CitationRateFactory factory;

    public CitationRateApplication(CitationRateFactory factory) {
        this.factory = factory;
    }

    public CitationRateApplication(String configPath) {
        this(CitationRateFactory.create(configPath));
    }

    /**
     * Smooths (and optionally forecasts) every paper of the input document.
     */
    public AnalysisDocument analyze(Path input, Path output) {
        CitationsDocument citations = factory.getDocumentStore().read(input, CitationsDocument.class);
        CitationRatePipeline pipeline = factory.getAnalysisPipeline();

        AnalysisRun run = pipeline.analyze(citations.toPaperRecords(), citations.getScrapedAt());

        AnalysisDocument document = AnalysisDocument.from(
                citations,
                run,
                AnalysisDocument.ModelInfo.of(pipeline.getProcessVariance(), pipeline.getMinCount(),
                        pipeline.getVarianceMode()),
                AnalysisDocument.ForecastAssumptions.of(pipeline.getProcessVariance(), pipeline.getMinCount(),
                        pipeline.getVarianceMode())
        );
        factory.getDocumentStore().write(output, document);

        if (run.hasFailures()) {
            log.warn("{} papers could not be analysed, see 'failures' in {}", run.failures().size(), output);
        }
        return document;
    }

    /**
     * Runs the hyperparameter grid search over the input document.
     */
    public TuningDocument tune(Path input, Path output) {
        CitationsDocument citations = factory.getDocumentStore().read(input, CitationsDocument.class);
        RateModelConfig config = factory.getConfig();

        TuningRun run = factory.getTuningPipeline().tune(citations.toPaperRecords(), citations.getScrapedAt());

        TuningDocument document = TuningDocument.from(input.toString(), config.getModel().getMinCount(), run);
        factory.getDocumentStore().write(output, document);
        return document;
    }

    public CitationRateFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        try {
            factory.exportMetrics();
        } catch (Exception e) {
            log.warn("Error writing metrics", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
    }

    public static void main(String[] args) {
        if (args.length < 3 || !("analyze".equals(args[0]) || "tune".equals(args[0]))) {
            log.error("Usage: (analyze|tune) <input.json> <output.json> [config.yaml]");
            System.exit(1);
            return;
        }

        String command = args[0];
        Path input = Path.of(args[1]);
        Path output = Path.of(args[2]);
        String configPath = args.length > 3 ? args[3] : ConfigLoader.DEFAULT_CONFIG;

        try (CitationRateApplication app = new CitationRateApplication(configPath)) {
            if ("analyze".equals(command)) {
                app.analyze(input, output);
            } else {
                app.tune(input, output);
            }
        } catch (Exception e) {
            log.error("Failed to {} {}", command, input, e);
            System.exit(1);
        }
    }
}
