/**
 * Thread and executor construction helpers.
 */
package ca.gc.cra.xlog.infrastructure.exec;
