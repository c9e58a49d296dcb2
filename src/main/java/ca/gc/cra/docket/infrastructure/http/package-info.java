/**
 * <strong>Purpose:</strong> HTTP transport to the upstream record API.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.docket.infrastructure.http.JdkHttpUpstreamAdapter} does the
 * I/O; {@link ca.gc.cra.docket.infrastructure.http.RetryingUpstreamAdapter} wraps it with a bounded retry budget.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.infrastructure.http;
