/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, configuration bootstrap and log parsing.
 * <p><strong>Pipeline role:</strong> Rejects invalid inputs before the analysis pool starts; host checks
 * are also applied to every endpoint token found in session logs.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Refuses control characters and symlinked report targets.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.validation;
