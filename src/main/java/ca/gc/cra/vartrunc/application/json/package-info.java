/**
 * Compact JSON reading and writing for {@link ca.gc.cra.vartrunc.domain.value.Value} trees, built on the Jackson
 * streaming API.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.application.json;
