/**
 * Line-level extraction of connection, package-install and logging-change events from raw session logs.
 * <p><strong>Role:</strong> Application layer; pure functions over text, no I/O.</p>
 * <p><strong>Concurrency:</strong> Parsers are stateless; each sequence iterator is single-threaded.</p>
 * <p><strong>Security:</strong> Raw lines are redacted and truncated before they are attached to events.</p>
 */
package ca.gc.cra.warden.application.parse;
