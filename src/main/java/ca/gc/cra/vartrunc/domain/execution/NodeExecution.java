package ca.gc.cra.vartrunc.domain.execution;

import ca.gc.cra.vartrunc.validation.Strings;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A single workflow node execution with its raw payloads.
 * <p><strong>Why:</strong> The execution repository truncates and offloads payloads on save; the truncated views
 * let callers display what was persisted inline.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; {@code with*} methods return copies.</p>
 *
 * @param id execution identifier
 * @param workflowRunId owning workflow run identifier
 * @param nodeId node identifier within the workflow graph
 * @param nodeType node type label
 * @param title display title
 * @param index position of the node in the run
 * @param status lifecycle state
 * @param createdAt creation timestamp
 * @param inputs raw inputs, if any
 * @param outputs raw outputs, if any
 * @param processData raw process data, if any
 * @param truncatedInputs inline view of inputs when they were offloaded
 * @param truncatedOutputs inline view of outputs when they were offloaded
 * @since 0.1.0
 */
public record NodeExecution(
    String id,
    String workflowRunId,
    String nodeId,
    String nodeType,
    String title,
    int index,
    NodeExecutionStatus status,
    Instant createdAt,
    Optional<Map<String, Object>> inputs,
    Optional<Map<String, Object>> outputs,
    Optional<Map<String, Object>> processData,
    Optional<Map<String, Object>> truncatedInputs,
    Optional<Map<String, Object>> truncatedOutputs) {

  public NodeExecution {
    id = Strings.requireNonBlank("id", id);
    workflowRunId = Strings.requireNonBlank("workflowRunId", workflowRunId);
    nodeId = Strings.requireNonBlank("nodeId", nodeId);
    nodeType = Strings.requireNonBlank("nodeType", nodeType);
    title = Objects.requireNonNullElse(title, "");
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    status = Objects.requireNonNull(status, "status");
    createdAt = Objects.requireNonNull(createdAt, "createdAt");
    inputs = Payloads.copy(inputs);
    outputs = Payloads.copy(outputs);
    processData = Payloads.copy(processData);
    truncatedInputs = Payloads.copy(truncatedInputs);
    truncatedOutputs = Payloads.copy(truncatedOutputs);
  }

  /**
   * Creates an execution without payloads.
   *
   * @param id execution identifier
   * @param workflowRunId owning workflow run identifier
   * @param nodeId node identifier
   * @param nodeType node type label
   * @param title display title
   * @param index position of the node in the run
   * @param status lifecycle state
   * @param createdAt creation timestamp
   * @return execution with empty payloads
   */
  public static NodeExecution of(
      String id,
      String workflowRunId,
      String nodeId,
      String nodeType,
      String title,
      int index,
      NodeExecutionStatus status,
      Instant createdAt) {
    return new NodeExecution(
        id, workflowRunId, nodeId, nodeType, title, index, status, createdAt,
        Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
  }

  /**
   * Returns a copy carrying the supplied payloads; {@code null} means absent.
   *
   * @param newInputs raw inputs or {@code null}
   * @param newOutputs raw outputs or {@code null}
   * @param newProcessData raw process data or {@code null}
   * @return updated copy
   */
  public NodeExecution withPayloads(
      Map<String, Object> newInputs, Map<String, Object> newOutputs, Map<String, Object> newProcessData) {
    return new NodeExecution(
        id, workflowRunId, nodeId, nodeType, title, index, status, createdAt,
        Optional.ofNullable(newInputs), Optional.ofNullable(newOutputs), Optional.ofNullable(newProcessData),
        truncatedInputs, truncatedOutputs);
  }

  /**
   * Returns a copy carrying the supplied truncated views.
   *
   * @param newTruncatedInputs inline inputs view or empty
   * @param newTruncatedOutputs inline outputs view or empty
   * @return updated copy
   */
  public NodeExecution withTruncatedViews(
      Optional<Map<String, Object>> newTruncatedInputs, Optional<Map<String, Object>> newTruncatedOutputs) {
    return new NodeExecution(
        id, workflowRunId, nodeId, nodeType, title, index, status, createdAt,
        inputs, outputs, processData, newTruncatedInputs, newTruncatedOutputs);
  }

  /**
   * Returns the raw payload for {@code field}.
   *
   * @param field payload field
   * @return raw payload or empty
   */
  public Optional<Map<String, Object>> payload(ExecutionField field) {
    return switch (field) {
      case INPUTS -> inputs;
      case OUTPUTS -> outputs;
      case PROCESS_DATA -> processData;
    };
  }
}
