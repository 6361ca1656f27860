/**
 * Clock adapters.
 */
package ca.gc.cra.warden.infrastructure.time;
