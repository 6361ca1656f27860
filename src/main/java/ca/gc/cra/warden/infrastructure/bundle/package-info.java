/**
 * Bundle sources reading downloaded session logs from local disk.
 * <p><strong>Role:</strong> Driven adapter behind {@link ca.gc.cra.warden.application.port.LogBundleSource}.</p>
 * <p><strong>Security:</strong> Only paths named by the index (or its session directory) are read.</p>
 */
package ca.gc.cra.warden.infrastructure.bundle;
