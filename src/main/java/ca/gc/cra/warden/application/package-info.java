/**
 * Application layer of WARDEN: parsing, classification, aggregation, reporting and the pipeline use case.
 * <p><strong>Role:</strong> Pure analysis logic behind hexagonal ports; no direct file or network access.</p>
 * <p><strong>Concurrency:</strong> Services are stateless and shared by the analysis workers.</p>
 */
package ca.gc.cra.warden.application;
