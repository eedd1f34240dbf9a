/**
 * <strong>Purpose:</strong> Command-line entry points for truncating JSON documents and offloading execution payloads.
 * <p><strong>Pipeline role:</strong> Adapter layer; parses {@code key=value} arguments, merges them with YAML and
 * defaults, wires the application services and maps failures to {@link ca.gc.cra.vartrunc.api.ExitCode}s.</p>
 * <p><strong>Concurrency:</strong> Single-threaded CLI execution.</p>
 * <p><strong>Observability:</strong> Logs errors before returning a failing exit code; {@code --verbose} raises
 * the root level to DEBUG.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.api;
