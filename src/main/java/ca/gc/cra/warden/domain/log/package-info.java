/**
 * Input model: session metadata and the raw Livy, stdout and stderr streams retrieved for it.
 * <p><strong>Role:</strong> Domain layer; populated by bundle sources, read by the analysis pipeline.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and may be shared across analysis workers.</p>
 */
package ca.gc.cra.warden.domain.log;
