package ca.gc.cra.vartrunc.application.offload;

import ca.gc.cra.vartrunc.domain.execution.ExecutionField;
import ca.gc.cra.vartrunc.domain.execution.ExecutionOffload;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of coordinating all payload fields of one execution.
 *
 * @param executionId execution identifier
 * @param fields decision per field; every {@link ExecutionField} is present
 * @param offload pointers to uploaded blobs; present iff at least one field was offloaded
 * @since 0.1.0
 */
public record OffloadOutcome(
    String executionId, Map<ExecutionField, FieldOffload> fields, Optional<ExecutionOffload> offload) {

  public OffloadOutcome {
    Objects.requireNonNull(executionId, "executionId");
    EnumMap<ExecutionField, FieldOffload> copy = new EnumMap<>(ExecutionField.class);
    copy.putAll(fields);
    for (ExecutionField field : ExecutionField.values()) {
      if (!copy.containsKey(field)) {
        throw new IllegalArgumentException("missing decision for " + field);
      }
    }
    fields = Collections.unmodifiableMap(copy);
    offload = offload == null ? Optional.empty() : offload;
  }

  /**
   * Returns the decision for {@code field}.
   *
   * @param field payload field
   * @return field decision
   */
  public FieldOffload field(ExecutionField field) {
    return fields.get(field);
  }

  /**
   * Returns the payload to persist inline for {@code field}.
   *
   * @param field payload field
   * @return inline payload or empty
   */
  public Optional<Map<String, Object>> inline(ExecutionField field) {
    return fields.get(field).inline();
  }
}
