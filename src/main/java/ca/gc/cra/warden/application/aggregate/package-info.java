/**
 * Per-session merge of stream events into security profiles.
 * <p><strong>Concurrency:</strong> Aggregators are shareable; each call builds its own state and runs on one
 * worker thread.</p>
 */
package ca.gc.cra.warden.application.aggregate;
