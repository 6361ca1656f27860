/**
 * Metrics adapters bridging {@link ca.gc.cra.warden.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are created lazily and cached.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code analysis.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and durations are exported, never log content or host names.</p>
 */
package ca.gc.cra.warden.infrastructure.metrics;
