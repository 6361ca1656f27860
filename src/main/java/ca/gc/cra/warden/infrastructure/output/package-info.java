/**
 * Report sinks: console, plain-text file and JSON file.
 * <p><strong>Role:</strong> Driven adapters behind {@link ca.gc.cra.warden.application.port.ReportSink}.</p>
 * <p><strong>Concurrency:</strong> Invoked once per run from the CLI thread.</p>
 * <p><strong>Security:</strong> Raw lines in reports are the redacted, truncated copies carried by events.</p>
 */
package ca.gc.cra.warden.infrastructure.output;
