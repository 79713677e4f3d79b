/**
 * Use cases driving the command channel and worker pool.
 * <p><strong>Role:</strong> Application layer; owns channel and pool lifetimes and enforces the
 * {@code stop()} then {@code join()} shutdown order.</p>
 * <p><strong>Concurrency:</strong> Use cases run on the caller's thread as the single producer; handlers run on pool threads.</p>
 * <p><strong>Metrics:</strong> {@code session.*} and {@code bench.*} keys.</p>
 */
package ca.gc.cra.flapline.application.pipeline;
