/**
 * Schema-free JSON handling for untrusted upstream payloads: Jackson streaming parse into maps and lists, and
 * dotted-path probing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.application.json;
