/**
 * Hexagonal ports of the analysis application.
 * <p><strong>Role:</strong> Driven-side abstractions for bundle retrieval, report output, metrics and time.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.warden.application.port.MetricsPort} implementations are
 * called from analysis workers and must be thread-safe; the other ports are used from the calling thread.</p>
 */
package ca.gc.cra.warden.application.port;
