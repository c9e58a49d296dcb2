/**
 * <strong>Purpose:</strong> Command-line surface of docket.
 * <p>{@link ca.gc.cra.docket.api.Main} dispatches {@code export} to {@link ca.gc.cra.docket.api.ExportCli}, which
 * turns {@code key=value} arguments into an {@link ca.gc.cra.docket.config.ExportConfig} and runs the export.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.api;
