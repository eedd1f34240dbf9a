/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and clip payload previews before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for truncation, offload and CLI diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Payload previews are clipped so full execution inputs never reach log files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.logging;
