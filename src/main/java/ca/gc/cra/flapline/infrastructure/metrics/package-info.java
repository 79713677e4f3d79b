/**
 * Metrics adapters bridging the {@link ca.gc.cra.flapline.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent maps; updates are safe from any worker.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code channel.*}, {@code pool.*}, {@code session.*}, and {@code bench.*}.</p>
 */
package ca.gc.cra.flapline.infrastructure.metrics;
