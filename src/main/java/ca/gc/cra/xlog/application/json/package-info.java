/**
 * Streaming JSON parsing and canonical serialization.
 */
package ca.gc.cra.xlog.application.json;
