package ca.gc.cra.vartrunc.application.port;

import ca.gc.cra.vartrunc.domain.execution.NodeExecutionRecord;
import java.util.Optional;

/**
 * <strong>What:</strong> Persistence port for node execution records and their offload pointers.
 * <p><strong>Why:</strong> The repository hands a record and its optional offload together so adapters can store
 * them in one unit of work.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface ExecutionRecordPort {
  /**
   * Inserts or replaces a record together with its offload pointer, if any.
   *
   * @param record record to persist; its {@code offload()} is stored alongside
   */
  void save(NodeExecutionRecord record);

  /**
   * Loads a record by execution id.
   *
   * @param executionId execution identifier
   * @return stored record, or empty when unknown
   */
  Optional<NodeExecutionRecord> findById(String executionId);

  /**
   * Removes a record and its offload pointer.
   *
   * @param executionId execution identifier
   * @return {@code true} when a record was removed
   */
  boolean delete(String executionId);
}
