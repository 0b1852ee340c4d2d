/**
 * Command-line entry points: the {@code xlog} dispatcher, the {@code serve} daemon and the {@code send} test client.
 * <p>Commands parse {@code key=value} arguments, merge them with YAML and embedded defaults, and map failures to
 * {@link ca.gc.cra.xlog.api.ExitCode} values.</p>
 */
package ca.gc.cra.xlog.api;
