package ca.gc.cra.vartrunc.infrastructure.persistence;

import ca.gc.cra.vartrunc.application.port.ExecutionRecordPort;
import ca.gc.cra.vartrunc.domain.execution.ExecutionOffload;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionRecord;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory execution store keeping records and offload pointers in two maps, like two tables joined by
 * execution id.
 *
 * <p>Writes and deletes lock the adapter so a record and its pointers always change together; reads are
 * lock-free.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryExecutionRecordAdapter implements ExecutionRecordPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionRecordAdapter.class);

  private final ConcurrentMap<String, NodeExecutionRecord> records = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ExecutionOffload> offloads = new ConcurrentHashMap<>();

  @Override
  public synchronized void save(NodeExecutionRecord record) {
    Objects.requireNonNull(record, "record");
    records.put(record.id(), record);
    if (record.offload().isPresent()) {
      offloads.put(record.id(), record.offload().get());
    } else {
      offloads.remove(record.id());
    }
    log.debug("Stored execution record {} (offload={})", record.id(), record.offload().isPresent());
  }

  @Override
  public Optional<NodeExecutionRecord> findById(String executionId) {
    return Optional.ofNullable(records.get(executionId));
  }

  @Override
  public synchronized boolean delete(String executionId) {
    offloads.remove(executionId);
    return records.remove(executionId) != null;
  }

  /**
   * Returns the stored offload pointers for an execution.
   *
   * @param executionId execution identifier
   * @return pointers or empty
   */
  public Optional<ExecutionOffload> findOffload(String executionId) {
    return Optional.ofNullable(offloads.get(executionId));
  }

  /**
   * Returns the number of stored records.
   *
   * @return record count
   */
  public int size() {
    return records.size();
  }
}
