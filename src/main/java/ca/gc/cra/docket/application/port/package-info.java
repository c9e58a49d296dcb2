/**
 * <strong>Purpose:</strong> Ports separating the export pipeline from transport, rendering, time, and metrics.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.port;
