/**
 * Analysis results: classified connections, per-session profiles and the run report.
 * <p><strong>Role:</strong> Domain model handed from the aggregator to the report builder and output sinks.</p>
 * <p><strong>Concurrency:</strong> Immutable once constructed.</p>
 */
package ca.gc.cra.warden.domain.report;
