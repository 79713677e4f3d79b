/**
 * Input sources feeding the producer loop.
 * <p><strong>Role:</strong> Adapters implementing {@link ca.gc.cra.flapline.application.port.InputSource}.</p>
 * <p><strong>Concurrency:</strong> Polled only from the producer thread; not thread-safe.</p>
 */
package ca.gc.cra.flapline.infrastructure.input;
