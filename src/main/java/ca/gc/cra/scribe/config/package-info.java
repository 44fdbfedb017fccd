/**
 * Configuration aggregates and composition root wiring for SCRIBE commands.
 * <p><strong>Role:</strong> Application bootstrap layer turning defaults, YAML and CLI arguments into an
 * {@link ca.gc.cra.scribe.config.ExtractConfig} and an adapter graph.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Passphrases are never part of configuration; only the name of the environment
 * variable that carries one is.</p>
 */
package ca.gc.cra.scribe.config;
