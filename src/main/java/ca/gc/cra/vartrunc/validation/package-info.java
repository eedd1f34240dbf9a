/**
 * <strong>Purpose:</strong> Validation helpers used during configuration bootstrap and at port boundaries.
 * <p><strong>Pipeline role:</strong> Domain support for truncator and offload configuration; ensures invalid
 * limits are rejected before a truncator or storage adapter is created.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Performance:</strong> Branch-only checks; no allocations beyond intermediate strings.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.validation;
