package ca.gc.cra.vartrunc.application.offload;

import ca.gc.cra.vartrunc.domain.execution.ExecutionField;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-field decision made by the {@link OffloadCoordinator}.
 *
 * @param field payload field
 * @param inline payload to persist inline; empty when the field was absent
 * @param fileId blob id of the full payload when it was offloaded
 * @param truncated whether {@code inline} is a truncated preview carrying the marker key
 * @since 0.1.0
 */
public record FieldOffload(
    ExecutionField field, Optional<Map<String, Object>> inline, Optional<String> fileId, boolean truncated) {

  public FieldOffload {
    Objects.requireNonNull(field, "field");
    inline = inline == null ? Optional.empty() : inline;
    fileId = fileId == null ? Optional.empty() : fileId;
    if (fileId.isPresent() && !truncated) {
      throw new IllegalArgumentException("offloaded field must carry a truncated preview");
    }
  }

  static FieldOffload absent(ExecutionField field) {
    return new FieldOffload(field, Optional.empty(), Optional.empty(), false);
  }

  static FieldOffload kept(ExecutionField field, Map<String, Object> payload) {
    return new FieldOffload(field, Optional.of(payload), Optional.empty(), false);
  }
}
