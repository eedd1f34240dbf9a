/**
 * <strong>Purpose:</strong> Closed, immutable model of JSON-compatible values handled by the truncator.
 * <p><strong>Pipeline role:</strong> Domain layer; produced from raw execution payloads and consumed by the size
 * estimator, the truncators and the compact JSON writer.
 * <p><strong>Concurrency:</strong> All values are immutable records; safe to share across threads.
 * <p><strong>Performance:</strong> Containers copy their elements once on construction.
 * <p><strong>Observability:</strong> No logging; conversion failures surface as unchecked exceptions.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.domain.value;
