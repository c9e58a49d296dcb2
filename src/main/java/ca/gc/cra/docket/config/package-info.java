/**
 * <strong>Purpose:</strong> Configuration sources and validation for the docket CLI.
 * <p><strong>Precedence:</strong> CLI {@code key=value} pairs, then the YAML file named by {@code config=}, then
 * {@link ca.gc.cra.docket.config.DefaultsForMode}. Credentials may also come from {@code DOCKET_*} environment
 * variables.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.config;
