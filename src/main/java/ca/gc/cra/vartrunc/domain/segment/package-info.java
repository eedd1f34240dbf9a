/**
 * Typed segment wrappers handed to the truncation dispatcher, plus opaque file references.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.domain.segment;
