/**
 * CLI entry points for the WARDEN {@code analyze} and {@code trusted-domains} commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * validates paths and invokes the analysis use case.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded during setup; the use case owns its worker pool.</p>
 * <p><strong>Metrics:</strong> Moves {@code metricsExporter}/{@code otelEndpoint} settings into {@code otel.*}
 * system properties before the OpenTelemetry adapter is created.</p>
 * <p><strong>Security:</strong> Refuses to overwrite report files unless {@code --allow-overwrite} is given.</p>
 */
package ca.gc.cra.warden.api;
