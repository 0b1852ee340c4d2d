/**
 * Raw console adapters.
 */
package ca.gc.cra.xlog.infrastructure.console;
