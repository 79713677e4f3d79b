/**
 * Time-related infrastructure adapters implementing clock ports.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Performance:</strong> Monotonic nanosecond reads; no allocation.</p>
 */
package ca.gc.cra.flapline.infrastructure.time;
