package ca.gc.cra.vartrunc.application.offload;

import ca.gc.cra.vartrunc.application.port.BlobStorageException;
import ca.gc.cra.vartrunc.application.port.ExecutionRecordPort;
import ca.gc.cra.vartrunc.domain.execution.ExecutionField;
import ca.gc.cra.vartrunc.domain.execution.NodeExecution;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionRecord;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Saves and loads node executions, truncating and offloading their payloads on the way in.
 * <p><strong>Why:</strong> Callers work with {@link NodeExecution}s; the store only ever sees records whose inline
 * payloads respect the offload threshold.</p>
 * <p><strong>Role:</strong> Application service over {@link ExecutionRecordPort} and {@link OffloadCoordinator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the coordinator and persist the record with its offload pointers as one unit.</li>
 *   <li>On read, expose inline payloads as truncated views exactly when a pointer is present.</li>
 *   <li>Delete a record together with its pointers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe when the injected ports are.</p>
 *
 * @since 0.1.0
 */
public final class NodeExecutionRepository {
  private static final Logger log = LoggerFactory.getLogger(NodeExecutionRepository.class);

  private final ExecutionRecordPort records;
  private final OffloadCoordinator coordinator;

  /**
   * Creates a repository.
   *
   * @param records record store
   * @param coordinator offload coordinator
   */
  public NodeExecutionRepository(ExecutionRecordPort records, OffloadCoordinator coordinator) {
    this.records = Objects.requireNonNull(records, "records");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
  }

  /**
   * Truncates, offloads and persists {@code execution}.
   *
   * @param execution execution to save
   * @return copy of {@code execution} carrying the truncated views of offloaded inputs and outputs
   * @throws BlobStorageException if an upload fails; nothing is persisted in that case
   */
  public NodeExecution save(NodeExecution execution) throws BlobStorageException {
    OffloadOutcome outcome = coordinator.coordinate(execution);
    NodeExecutionRecord record = toRecord(execution, outcome);
    records.save(record);
    log.debug("Saved execution {} (inputsTruncated={}, outputsTruncated={})",
        execution.id(), record.inputsTruncated(), record.outputsTruncated());
    return execution.withTruncatedViews(
        truncatedView(outcome.field(ExecutionField.INPUTS)),
        truncatedView(outcome.field(ExecutionField.OUTPUTS)));
  }

  /**
   * Loads an execution as persisted.
   *
   * @param executionId execution identifier
   * @return execution whose payloads are the inline ones, or empty when unknown
   */
  public Optional<NodeExecution> findById(String executionId) {
    return records.findById(executionId).map(NodeExecutionRepository::toDomain);
  }

  /**
   * Loads the persisted record, including its offload pointers.
   *
   * @param executionId execution identifier
   * @return stored record or empty
   */
  public Optional<NodeExecutionRecord> findRecord(String executionId) {
    return records.findById(executionId);
  }

  /**
   * Deletes an execution and its offload pointers.
   *
   * @param executionId execution identifier
   * @return {@code true} when a record was removed
   */
  public boolean delete(String executionId) {
    return records.delete(executionId);
  }

  static NodeExecutionRecord toRecord(NodeExecution execution, OffloadOutcome outcome) {
    return new NodeExecutionRecord(
        execution.id(),
        execution.workflowRunId(),
        execution.nodeId(),
        execution.nodeType(),
        execution.title(),
        execution.index(),
        execution.status(),
        execution.createdAt(),
        outcome.inline(ExecutionField.INPUTS),
        outcome.inline(ExecutionField.OUTPUTS),
        outcome.inline(ExecutionField.PROCESS_DATA),
        outcome.offload());
  }

  static NodeExecution toDomain(NodeExecutionRecord record) {
    Optional<Map<String, Object>> truncatedInputs =
        record.inputsTruncated() ? record.inputs() : Optional.empty();
    Optional<Map<String, Object>> truncatedOutputs =
        record.outputsTruncated() ? record.outputs() : Optional.empty();
    return new NodeExecution(
        record.id(),
        record.workflowRunId(),
        record.nodeId(),
        record.nodeType(),
        record.title(),
        record.index(),
        record.status(),
        record.createdAt(),
        record.inputs(),
        record.outputs(),
        record.processData(),
        truncatedInputs,
        truncatedOutputs);
  }

  private static Optional<Map<String, Object>> truncatedView(FieldOffload decision) {
    return decision.fileId().isPresent() ? decision.inline() : Optional.empty();
  }
}
