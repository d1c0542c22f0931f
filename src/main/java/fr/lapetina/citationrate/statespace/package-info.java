/**
 * Scalar local-level state-space model: forward filter, backward smoother and forecaster.
 *
 * <p>All recursions run single-threaded along the time axis of one series over flat arrays
 * indexed by time step. Instances hold only their parameters and are safe to share between
 * worker threads processing different series.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.citationrate.statespace.LocalLevelFilter} - Kalman filter and marginal log-likelihood</li>
 *   <li>{@link fr.lapetina.citationrate.statespace.RtsSmoother} - Rauch-Tung-Striebel smoother</li>
 *   <li>{@link fr.lapetina.citationrate.statespace.Forecaster} - Closed-form and sampled multi-step forecasts</li>
 * </ul>
 */
package fr.lapetina.citationrate.statespace;
