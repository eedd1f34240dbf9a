/**
 * Configuration records and loaders for the truncation and offload pipeline.
 * <p><strong>Role:</strong> Application bootstrap layer; turns YAML, CLI and default key/value maps into validated
 * {@link ca.gc.cra.vartrunc.config.TruncatorConfig} and {@link ca.gc.cra.vartrunc.config.OffloadConfig}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates limits and paths through {@code ca.gc.cra.vartrunc.validation} utilities.</p>
 */
package ca.gc.cra.vartrunc.config;
