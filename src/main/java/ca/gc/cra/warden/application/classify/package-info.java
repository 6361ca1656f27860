/**
 * Trust classification of extracted endpoints.
 * <p><strong>Concurrency:</strong> Stateless; safe to share across analysis workers.</p>
 */
package ca.gc.cra.warden.application.classify;
