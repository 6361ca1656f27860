/**
 * Report assembly: summary counts, external-only filtering and deterministic ordering.
 */
package ca.gc.cra.warden.application.report;
