package ca.gc.cra.vartrunc.application.offload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vartrunc.application.port.BlobStorageException;
import ca.gc.cra.vartrunc.application.truncate.JsonSizeEstimator;
import ca.gc.cra.vartrunc.config.OffloadConfig;
import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.execution.ExecutionField;
import ca.gc.cra.vartrunc.domain.execution.ExecutionOffload;
import ca.gc.cra.vartrunc.domain.execution.NodeExecution;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionStatus;
import ca.gc.cra.vartrunc.domain.value.Values;
import ca.gc.cra.vartrunc.testutil.FailingBlobStorage;
import ca.gc.cra.vartrunc.testutil.Payloads;
import ca.gc.cra.vartrunc.testutil.RecordingBlobStorage;
import ca.gc.cra.vartrunc.testutil.RecordingMetricsPort;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OffloadCoordinatorTest {
  private static final int THRESHOLD = OffloadConfig.DEFAULT_THRESHOLD_BYTES;

  private final RecordingBlobStorage storage = new RecordingBlobStorage();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final OffloadCoordinator coordinator = new OffloadCoordinator(
      OffloadConfig.defaults(), TruncatorConfig.defaults(), storage, metrics);

  private static NodeExecution execution(
      Map<String, Object> inputs, Map<String, Object> outputs, Map<String, Object> processData) {
    return NodeExecution.of("exec-1", "run-1", "node-1", "llm", "LLM", 0,
            NodeExecutionStatus.SUCCEEDED, Instant.EPOCH)
        .withPayloads(inputs, outputs, processData);
  }

  private static int size(Map<String, Object> payload) {
    return JsonSizeEstimator.estimate(Values.ofMap(payload));
  }

  @Test
  void smallPayloadsStayInline() throws Exception {
    OffloadOutcome outcome = coordinator.coordinate(
        execution(Payloads.small(), Payloads.small(), Payloads.small()));

    assertEquals(0, storage.count());
    assertTrue(outcome.offload().isEmpty());
    assertEquals(Optional.of(Payloads.small()), outcome.inline(ExecutionField.INPUTS));
    assertFalse(outcome.field(ExecutionField.OUTPUTS).truncated());
    assertEquals(3, metrics.count("offload.field.inline"));
  }

  @Test
  void absentFieldsProduceNoDecisionPayload() throws Exception {
    OffloadOutcome outcome = coordinator.coordinate(execution(null, null, null));

    for (ExecutionField field : ExecutionField.values()) {
      assertTrue(outcome.inline(field).isEmpty());
    }
    assertTrue(outcome.offload().isEmpty());
  }

  @Test
  void oversizedInputsAreUploadedOnce() throws Exception {
    OffloadOutcome outcome = coordinator.coordinate(
        execution(Payloads.ofDataChars(11_000), Payloads.small(), null));

    assertEquals(1, storage.count());
    ExecutionOffload offload = outcome.offload().orElseThrow();
    assertEquals(Optional.of("file-1"), offload.inputsFileId());
    assertTrue(offload.outputsFileId().isEmpty());
    assertEquals("node_execution_exec-1_inputs.json", storage.uploads().get(0).filename());
    assertEquals(OffloadCoordinator.PAYLOAD_MIME_TYPE, storage.uploads().get(0).mimeType());
    assertEquals(1, metrics.count("offload.upload.success"));
    assertTrue(metrics.observed("offload.upload.bytes").get(0) > THRESHOLD);
  }

  @Test
  void inlinePreviewCarriesMarkerAndFitsThreshold() throws Exception {
    OffloadOutcome outcome = coordinator.coordinate(
        execution(Payloads.ofDataChars(11_000), null, null));

    Map<String, Object> preview = outcome.inline(ExecutionField.INPUTS).orElseThrow();
    assertEquals(Boolean.TRUE, preview.get(OffloadCoordinator.TRUNCATED_MARKER));
    assertTrue(((String) preview.get("data")).endsWith("..."));
    assertTrue(size(preview) <= THRESHOLD, "preview size " + size(preview));
    assertTrue(outcome.field(ExecutionField.INPUTS).truncated());
  }

  @Test
  void bothOversizedFieldsAreUploaded() throws Exception {
    OffloadOutcome outcome = coordinator.coordinate(
        execution(Payloads.ofDataChars(11_000), Payloads.ofDataChars(12_000), null));

    assertEquals(2, storage.count());
    assertEquals(Optional.of("file-1"), outcome.offload().orElseThrow().inputsFileId());
    assertEquals(Optional.of("file-2"), outcome.offload().orElseThrow().outputsFileId());
    assertEquals("node_execution_exec-1_outputs.json", storage.uploads().get(1).filename());
  }

  @Test
  void uploadedContentIsSortedCompactJson() throws Exception {
    Map<String, Object> inputs = new LinkedHashMap<>();
    inputs.put("zeta", 1L);
    inputs.put("alpha", "x".repeat(11_000));

    coordinator.coordinate(execution(inputs, null, null));

    String text = storage.uploads().get(0).text();
    assertTrue(text.startsWith("{\"alpha\":\"xxx"), text.substring(0, 20));
    assertTrue(text.endsWith("\",\"zeta\":1}"));
  }

  @Test
  void oversizedProcessDataIsTruncatedWithoutUpload() throws Exception {
    OffloadOutcome outcome = coordinator.coordinate(
        execution(null, null, Payloads.ofDataChars(11_000)));

    assertEquals(0, storage.count());
    assertTrue(outcome.offload().isEmpty());
    FieldOffload decision = outcome.field(ExecutionField.PROCESS_DATA);
    assertTrue(decision.truncated());
    assertTrue(decision.fileId().isEmpty());
    Map<String, Object> preview = decision.inline().orElseThrow();
    assertEquals(Boolean.TRUE, preview.get(OffloadCoordinator.TRUNCATED_MARKER));
    assertTrue(size(preview) <= THRESHOLD);
  }

  @Test
  void existingMarkerKeyIsReplaced() {
    Map<String, Object> payload = Payloads.ofDataChars(11_000);
    payload.put(OffloadCoordinator.TRUNCATED_MARKER, "stale");

    Map<String, Object> preview = coordinator.truncateWithMarker(payload);

    assertEquals(Boolean.TRUE, preview.get(OffloadCoordinator.TRUNCATED_MARKER));
  }

  @Test
  void uploadFailurePropagates() {
    FailingBlobStorage failing = new FailingBlobStorage();
    OffloadCoordinator failingCoordinator = new OffloadCoordinator(
        OffloadConfig.defaults(), TruncatorConfig.defaults(), failing, metrics);

    assertThrows(BlobStorageException.class,
        () -> failingCoordinator.coordinate(execution(Payloads.ofDataChars(11_000), null, null)));
    assertEquals(1, failing.attempts());
    assertEquals(1, metrics.count("offload.upload.failure"));
    assertFalse(metrics.hasCounter("offload.upload.success"));
  }

  @Test
  void blobFileNameReplacesUnsafeCharacters() {
    assertEquals("node_execution_a_b_outputs.json",
        OffloadCoordinator.blobFileName("a/b", ExecutionField.OUTPUTS));
  }
}
