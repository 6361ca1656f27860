/**
 * Closed set of line-level events extracted from session logs.
 * <p><strong>Role:</strong> Domain model produced by the log parser and consumed by the session aggregator.</p>
 * <p><strong>Concurrency:</strong> Immutable records.</p>
 * <p><strong>Security:</strong> Raw lines carried by events are already redacted and truncated.</p>
 */
package ca.gc.cra.warden.domain.events;
