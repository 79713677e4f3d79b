/**
 * CLI entry points for FLAPLINE play sessions and channel benchmarks.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, configure logging and telemetry, invoke use cases.</p>
 * <p><strong>Concurrency:</strong> Commands run on the caller's thread, which becomes the channel's single producer.</p>
 */
package ca.gc.cra.flapline.api;
