/**
 * Domain model for XLOG: time snapshots, log path templates and the persisted record layout.
 * <p><strong>Dependencies:</strong> JDK only.</p>
 */
package ca.gc.cra.xlog.domain;
