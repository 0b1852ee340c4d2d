/**
 * Shared clock state publishing immutable time snapshots.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xlog.application.clock;
