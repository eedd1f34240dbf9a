package ca.gc.cra.vartrunc.domain.execution;

import ca.gc.cra.vartrunc.validation.Strings;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted shape of a node execution: scalar columns, inline payloads (already truncated where needed) and the
 * optional offload pointers.
 *
 * @param id execution identifier
 * @param workflowRunId owning workflow run identifier
 * @param nodeId node identifier
 * @param nodeType node type label
 * @param title display title
 * @param index position of the node in the run
 * @param status lifecycle state
 * @param createdAt creation timestamp
 * @param inputs inline inputs
 * @param outputs inline outputs
 * @param processData inline process data
 * @param offload pointers to full payloads; present iff at least one field was offloaded
 * @since 0.1.0
 */
public record NodeExecutionRecord(
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
    Optional<ExecutionOffload> offload) {

  public NodeExecutionRecord {
    id = Strings.requireNonBlank("id", id);
    status = Objects.requireNonNull(status, "status");
    createdAt = Objects.requireNonNull(createdAt, "createdAt");
    inputs = Payloads.copy(inputs);
    outputs = Payloads.copy(outputs);
    processData = Payloads.copy(processData);
    offload = offload == null ? Optional.empty() : offload;
    if (offload.isPresent() && !offload.get().executionId().equals(id)) {
      throw new IllegalArgumentException("offload belongs to execution " + offload.get().executionId());
    }
  }

  /**
   * Indicates whether the inline inputs are a truncated preview of an offloaded payload.
   *
   * @return {@code true} when an inputs pointer is present
   */
  public boolean inputsTruncated() {
    return offload.flatMap(ExecutionOffload::inputsFileId).isPresent();
  }

  /**
   * Indicates whether the inline outputs are a truncated preview of an offloaded payload.
   *
   * @return {@code true} when an outputs pointer is present
   */
  public boolean outputsTruncated() {
    return offload.flatMap(ExecutionOffload::outputsFileId).isPresent();
  }
}
