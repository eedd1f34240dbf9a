package ca.gc.cra.vartrunc.domain.execution;

import ca.gc.cra.vartrunc.validation.Strings;
import java.util.Optional;

/**
 * <strong>What:</strong> Pointers from an execution record to the blobs holding its full inputs and outputs.
 * <p><strong>Why:</strong> Read-side consumers treat a field as truncated exactly when its pointer is present.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param executionId owning execution identifier
 * @param inputsFileId blob id of the full inputs, when offloaded
 * @param outputsFileId blob id of the full outputs, when offloaded
 * @since 0.1.0
 */
public record ExecutionOffload(
    String executionId, Optional<String> inputsFileId, Optional<String> outputsFileId) {

  /**
   * Validates the identifiers.
   *
   * @throws IllegalArgumentException if neither pointer is present
   */
  public ExecutionOffload {
    executionId = Strings.requireNonBlank("executionId", executionId);
    inputsFileId = inputsFileId == null ? Optional.empty() : inputsFileId;
    outputsFileId = outputsFileId == null ? Optional.empty() : outputsFileId;
    if (inputsFileId.isEmpty() && outputsFileId.isEmpty()) {
      throw new IllegalArgumentException("offload requires at least one file id");
    }
  }

  /**
   * Returns the pointer for {@code field}.
   *
   * @param field payload field
   * @return file id; always empty for {@link ExecutionField#PROCESS_DATA}
   */
  public Optional<String> fileId(ExecutionField field) {
    return switch (field) {
      case INPUTS -> inputsFileId;
      case OUTPUTS -> outputsFileId;
      case PROCESS_DATA -> Optional.empty();
    };
  }
}
