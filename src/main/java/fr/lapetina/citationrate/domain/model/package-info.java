/**
 * Immutable value types flowing through the citation rate pipeline.
 *
 * <p>Values are composed by passing them forward; no type holds a reference back to the
 * value it was derived from.
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link fr.lapetina.citationrate.domain.model.PaperRecord} - Raw paper as delivered by the source</li>
 *   <li>{@link fr.lapetina.citationrate.domain.model.PreparedSeries} - Year-aligned counts, rates and log observations</li>
 *   <li>{@link fr.lapetina.citationrate.domain.model.FilterResult} - Forward pass output and log-likelihood</li>
 *   <li>{@link fr.lapetina.citationrate.domain.model.SmoothResult} - Backward pass output</li>
 *   <li>{@link fr.lapetina.citationrate.domain.model.Forecast} - Multi-step predictive distribution and samples</li>
 *   <li>{@link fr.lapetina.citationrate.domain.model.HyperparameterGridResult} - Scored tuning grid</li>
 * </ul>
 */
package fr.lapetina.citationrate.domain.model;
