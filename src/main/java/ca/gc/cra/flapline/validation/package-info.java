/**
 * Input validation helpers for configuration and CLI parsing.
 * <p><strong>Role:</strong> Stateless utilities; failures surface as {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.flapline.validation;
