/**
 * Citation Rates - smoothing, forecasting and likelihood tuning of yearly citation counts.
 *
 * <p>Each paper's yearly counts are turned into log-rate observations and run through a
 * scalar local-level Kalman filter and Rauch-Tung-Striebel smoother. Smoothed rates can be
 * extended with lognormal forecasts, and the model's hyperparameters can be chosen by a
 * grid search over the total marginal likelihood of a corpus.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.citationrate.CitationRateFactory} - Creates the fully-wired pipelines
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.citationrate.CitationRateApplication} - Command line entry point
 *       for the {@code analyze} and {@code tune} commands</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (CitationRateFactory factory = CitationRateFactory.create("citation-rates.yaml")) {
 *     AnalysisRun run = factory.getAnalysisPipeline().analyze(papers, "2024-07-01T00:00:00Z");
 *     run.papers().forEach(paper -> System.out.println(paper.title() + " " + paper.smoothed().finalMean()));
 * }
 * }</pre>
 *
 * @see fr.lapetina.citationrate.pipeline.CitationRatePipeline
 * @see fr.lapetina.citationrate.tuning.HyperparameterTuner
 */
package fr.lapetina.citationrate;
