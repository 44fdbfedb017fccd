/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep paths and content out of logs.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Security:</strong> Home directories are redacted to {@code ~}; message text is never logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.logging;
