/**
 * Worker pool and thread factories for command consumers.
 * <p><strong>Role:</strong> Infrastructure owning the platform threads that run {@link ca.gc.cra.flapline.application.port.CommandHandler} loops.</p>
 * <p><strong>Concurrency:</strong> Lifecycle transitions (start, join, teardown) are serialized on a private monitor; joins block outside it.</p>
 * <p><strong>Performance:</strong> Thread count is fixed at construction; no threads are created or retired afterwards.</p>
 * <p><strong>Metrics:</strong> Publishes {@code pool.worker.*} counters and {@code pool.teardown.detached}.</p>
 * <p><strong>Security:</strong> Thread names carry only the configured prefix and an index.</p>
 */
package ca.gc.cra.flapline.infrastructure.exec;
