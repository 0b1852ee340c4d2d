/**
 * Flat-file path templating keyed off local calendar time.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xlog.domain.path;
