/**
 * Console viewers rendering persisted records for operators.
 */
package ca.gc.cra.xlog.infrastructure.viewer;
