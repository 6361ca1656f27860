/**
 * Executor factories with named, non-daemon worker threads.
 */
package ca.gc.cra.warden.infrastructure.exec;
