/**
 * Corpus-level pipelines built on the state-space model.
 *
 * <p>Papers and grid cells are independent, so both pipelines fan work out on an
 * {@link java.util.concurrent.Executor} with {@link java.util.concurrent.CompletableFuture}
 * and collect the results in input order.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Validation → Preparation → Filter → Smoother → Forecast → H-index projection
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.citationrate.pipeline.CitationRatePipeline} - Per-paper analysis</li>
 *   <li>{@link fr.lapetina.citationrate.pipeline.TuningPipeline} - Corpus preparation and grid search</li>
 *   <li>{@link fr.lapetina.citationrate.pipeline.HIndexProjector} - H-index timeline from smoothed and forecast rates</li>
 * </ul>
 */
package fr.lapetina.citationrate.pipeline;
