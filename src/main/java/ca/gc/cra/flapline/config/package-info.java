/**
 * Settings records, YAML loading and composition root wiring for FLAPLINE CLIs.
 * <p><strong>Role:</strong> Bootstrap layer turning CLI and YAML key/value pairs into validated settings.</p>
 * <p><strong>Concurrency:</strong> Settings records are immutable; safe to share with worker threads.</p>
 */
package ca.gc.cra.flapline.config;
