/**
 * Node execution aggregate as seen by the persistence boundary: the in-flight domain object, its persisted
 * record shape and the offload pointers that mark truncated fields.
 *
 * <p>Payload maps are plain Java graphs ({@code String}, {@code Number}, {@code Boolean}, {@code null},
 * {@code List}, {@code Map}) copied into unmodifiable insertion-ordered maps.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.domain.execution;
