/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize payloads before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for fetch, enrichment, and export diagnostics.
 * <p><strong>Security:</strong> Provides redaction helpers so bearer tokens never reach log output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.logging;
