/**
 * Infrastructure adapters: bundle reading, report output, metrics, executors and time.
 * <p><strong>Role:</strong> Driven side of the hexagon; implements the application ports.</p>
 */
package ca.gc.cra.warden.infrastructure;
