/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize log-line text before it is
 * stored or emitted.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from analysis workers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Masks credentials found in session logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.logging;
