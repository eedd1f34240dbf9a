package ca.gc.cra.vartrunc.application.offload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vartrunc.application.port.BlobStorageException;
import ca.gc.cra.vartrunc.application.port.BlobStoragePort;
import ca.gc.cra.vartrunc.application.port.MetricsPort;
import ca.gc.cra.vartrunc.config.OffloadConfig;
import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.execution.NodeExecution;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionRecord;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionStatus;
import ca.gc.cra.vartrunc.infrastructure.persistence.InMemoryExecutionRecordAdapter;
import ca.gc.cra.vartrunc.testutil.FailingBlobStorage;
import ca.gc.cra.vartrunc.testutil.Payloads;
import ca.gc.cra.vartrunc.testutil.RecordingBlobStorage;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class NodeExecutionRepositoryTest {
  private final InMemoryExecutionRecordAdapter records = new InMemoryExecutionRecordAdapter();
  private final RecordingBlobStorage storage = new RecordingBlobStorage();

  private NodeExecutionRepository repository(BlobStoragePort blobs) {
    OffloadCoordinator coordinator = new OffloadCoordinator(
        OffloadConfig.defaults(), TruncatorConfig.defaults(), blobs, MetricsPort.NO_OP);
    return new NodeExecutionRepository(records, coordinator);
  }

  private static NodeExecution execution(String id, Map<String, Object> inputs, Map<String, Object> outputs) {
    return NodeExecution.of(id, "run-1", "node-1", "tool", "Search", 2,
            NodeExecutionStatus.SUCCEEDED, Instant.parse("2024-01-01T00:00:00Z"))
        .withPayloads(inputs, outputs, null);
  }

  @Test
  void saveKeepsSmallPayloadsWithoutTruncatedViews() throws Exception {
    NodeExecution saved = repository(storage).save(execution("e-1", Payloads.small(), Payloads.small()));

    assertTrue(saved.truncatedInputs().isEmpty());
    assertTrue(saved.truncatedOutputs().isEmpty());
    NodeExecutionRecord record = records.findById("e-1").orElseThrow();
    assertEquals(Optional.of(Payloads.small()), record.inputs());
    assertTrue(record.offload().isEmpty());
  }

  @Test
  void saveReturnsTruncatedViewOfOffloadedInputs() throws Exception {
    NodeExecution raw = execution("e-2", Payloads.ofDataChars(11_000), Payloads.small());

    NodeExecution saved = repository(storage).save(raw);

    assertEquals(raw.inputs(), saved.inputs());
    Map<String, Object> view = saved.truncatedInputs().orElseThrow();
    assertEquals(Boolean.TRUE, view.get(OffloadCoordinator.TRUNCATED_MARKER));
    assertTrue(saved.truncatedOutputs().isEmpty());

    NodeExecutionRecord record = records.findById("e-2").orElseThrow();
    assertTrue(record.inputsTruncated());
    assertFalse(record.outputsTruncated());
    assertEquals(Optional.of("file-1"), records.findOffload("e-2").orElseThrow().inputsFileId());
  }

  @Test
  void findByIdExposesInlinePayloadsAsTruncatedViews() throws Exception {
    NodeExecutionRepository repository = repository(storage);
    repository.save(execution("e-3", null, Payloads.ofDataChars(20_000)));

    NodeExecution loaded = repository.findById("e-3").orElseThrow();

    assertEquals(loaded.outputs(), loaded.truncatedOutputs());
    assertTrue(loaded.truncatedInputs().isEmpty());
    assertEquals(2, loaded.index());
    assertEquals("Search", loaded.title());
  }

  @Test
  void failedUploadPersistsNothing() {
    NodeExecutionRepository repository = repository(new FailingBlobStorage());

    assertThrows(BlobStorageException.class,
        () -> repository.save(execution("e-4", Payloads.ofDataChars(11_000), null)));
    assertEquals(0, records.size());
    assertTrue(repository.findRecord("e-4").isEmpty());
  }

  @Test
  void deleteRemovesRecordAndPointers() throws Exception {
    NodeExecutionRepository repository = repository(storage);
    repository.save(execution("e-5", Payloads.ofDataChars(11_000), null));

    assertTrue(repository.delete("e-5"));
    assertTrue(repository.findById("e-5").isEmpty());
    assertTrue(records.findOffload("e-5").isEmpty());
    assertFalse(repository.delete("e-5"));
  }
}
