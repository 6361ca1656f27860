/**
 * Configuration loading and wiring for WARDEN commands.
 *
 * <p><strong>Role:</strong> Merges defaults, YAML and CLI values ({@link ca.gc.cra.warden.config.ConfigMerger}),
 * materializes {@link ca.gc.cra.warden.config.AnalyzeConfig}, loads the trust catalog and wires the use case
 * ({@link ca.gc.cra.warden.config.CompositionRoot}).</p>
 * <p><strong>Concurrency:</strong> Used on the CLI thread during startup.</p>
 * <p><strong>Security:</strong> Paths are normalized here and validated by the CLI before any file is written.</p>
 */
package ca.gc.cra.warden.config;
