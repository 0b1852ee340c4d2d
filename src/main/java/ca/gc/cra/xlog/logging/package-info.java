/**
 * Logging helpers shared across XLOG components.
 * <p><strong>Role:</strong> Provides log level control and truncation/shortening utilities for diagnostics.</p>
 * <p><strong>Thread-safety:</strong> Utilities are stateless; level changes happen during CLI bootstrap.</p>
 */
package ca.gc.cra.xlog.logging;
