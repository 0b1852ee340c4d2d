/**
 * <strong>Purpose:</strong> Line validation, control-key coercion and canonical fingerprinting.
 * <p><strong>Concurrency:</strong> Invoked concurrently from every connection thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xlog.application.normalize;
