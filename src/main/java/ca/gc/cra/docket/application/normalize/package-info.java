/**
 * <strong>Purpose:</strong> Entity normalization from untrusted upstream payloads to canonical items.
 * <p>Field fallbacks are declared as ordered {@code (path, parser)} tables evaluated by one first-match combinator.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.normalize;
