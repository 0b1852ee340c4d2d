/**
 * <strong>Purpose:</strong> Input validation for CLI arguments and configuration values.
 * <p><strong>Failure model:</strong> Violations raise {@link java.lang.IllegalArgumentException} with a message
 * naming the offending setting; the CLI maps them to {@code INVALID_ARGS}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xlog.validation;
