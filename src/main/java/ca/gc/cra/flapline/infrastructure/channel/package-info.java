/**
 * Command channel implementations.
 * <p><strong>Role:</strong> Adapter implementing the {@link ca.gc.cra.flapline.application.port.CommandChannel} port.</p>
 * <p><strong>Concurrency:</strong> One lock guards the pending deque and the stop flag; takers wait on a single condition.</p>
 * <p><strong>Performance:</strong> Producers never wait beyond the critical section; bounded channels drop instead of blocking.</p>
 * <p><strong>Metrics:</strong> Publishes {@code channel.submit.*} counters and {@code channel.depth} samples.</p>
 */
package ca.gc.cra.flapline.infrastructure.channel;
