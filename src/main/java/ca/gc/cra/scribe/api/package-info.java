/**
 * CLI entry points for the SCRIBE extract and inspect commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and invokes use cases.</p>
 * <p><strong>Errors:</strong> Fatal pipeline failures are printed as problem JSON on stderr and mapped to
 * {@link ca.gc.cra.scribe.api.ExitCode} values.</p>
 * <p><strong>Security:</strong> Passphrases are removed from the argument map before configuration is merged or
 * logged.</p>
 */
package ca.gc.cra.scribe.api;
