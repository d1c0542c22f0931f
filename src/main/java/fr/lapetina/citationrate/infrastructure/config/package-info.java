/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a typed configuration model and
 * rejects inconsistent values before a run starts.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.citationrate.infrastructure.config.RateModelConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.citationrate.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code model} - Process variance, observation variance mode, pseudocount, variance floor</li>
 *   <li>{@code forecast} - Horizon in years, sampling seed, sampling noise floor</li>
 *   <li>{@code tuning} - Grid size, grid bounds, minimum series length</li>
 *   <li>{@code execution} - Worker pool size</li>
 *   <li>{@code metrics} - Prometheus metrics prefix and optional output file</li>
 * </ul>
 *
 * @see fr.lapetina.citationrate.infrastructure.config.RateModelConfig
 * @see fr.lapetina.citationrate.infrastructure.config.ConfigLoader
 */
package fr.lapetina.citationrate.infrastructure.config;
