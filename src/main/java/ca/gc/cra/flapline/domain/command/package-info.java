/**
 * Command values transferred from the producer loop to worker threads.
 * <p><strong>Concurrency:</strong> Types are immutable and safe to publish through the command channel.</p>
 * <p><strong>Metrics:</strong> Command timestamps feed {@code session.command.latencyMicros}.</p>
 */
package ca.gc.cra.flapline.domain.command;
