/**
 * <strong>Purpose:</strong> Ports connecting XLOG use cases to clocks, metrics, the flat-file sink, the network
 * listener and console viewers.
 * <p><strong>Pipeline:</strong> Listener -> normalizer -> queue -> writer -> sink / viewer.</p>
 * <p><strong>Thread-safety:</strong> Documented per port; most are invoked from several threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xlog.application.port;
