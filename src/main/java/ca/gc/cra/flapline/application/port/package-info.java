/**
 * Ports connecting the command hand-off core to its collaborators.
 * <p><strong>Role:</strong> Hexagonal boundary: the channel/handler contract consumed by the worker pool,
 * plus input, clock, and metrics ports consumed by the session use cases.</p>
 * <p><strong>Concurrency:</strong> Each interface documents which threads may call it; channel and metrics
 * implementations must be fully thread-safe.</p>
 * <p><strong>Metrics:</strong> Metric names are dotted ({@code channel.*}, {@code pool.*}, {@code session.*}).</p>
 */
package ca.gc.cra.flapline.application.port;
