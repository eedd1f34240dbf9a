/**
 * <strong>Purpose:</strong> Budgeted truncation of JSON-compatible values.
 * <p><strong>Pipeline role:</strong> Application layer; {@link ca.gc.cra.vartrunc.application.truncate.ValueTruncator}
 * is the entry point and dispatches on segment type to the string and container truncators, which share budgets
 * through {@link ca.gc.cra.vartrunc.application.truncate.BudgetAllocator}.</p>
 * <p><strong>Concurrency:</strong> Every class here is immutable; one configured truncator may serve any number
 * of threads.</p>
 * <p><strong>Performance:</strong> Sizes are computed by {@link ca.gc.cra.vartrunc.application.truncate.JsonSizeEstimator}
 * without encoding; only the final fallback serializes.</p>
 * <p><strong>Ordering:</strong> Truncated objects always list their keys in lexicographic order, so identical input
 * and configuration produce identical output.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.application.truncate;
