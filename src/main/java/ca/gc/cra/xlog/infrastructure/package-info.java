/**
 * Infrastructure adapters implementing XLOG ports: sockets, files, clocks, consoles, viewers and metrics.
 */
package ca.gc.cra.xlog.infrastructure;
