/**
 * Logging helpers shared by CLI entry points.
 * <p><strong>Role:</strong> Adapter-side glue over SLF4J and Logback.</p>
 * <p><strong>Concurrency:</strong> Call during bootstrap only.</p>
 */
package ca.gc.cra.flapline.logging;
