/**
 * Trusted-domain catalog and host matching.
 * <p><strong>Concurrency:</strong> Catalog instances are immutable and shared read-only by every worker.</p>
 * <p><strong>Security:</strong> Anything the catalog does not match is reported as external.</p>
 */
package ca.gc.cra.warden.domain.trust;
