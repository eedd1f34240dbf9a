package ca.gc.cra.vartrunc.application.offload;

import ca.gc.cra.vartrunc.application.json.CompactJsonWriter;
import ca.gc.cra.vartrunc.application.port.BlobStorageException;
import ca.gc.cra.vartrunc.application.port.BlobStoragePort;
import ca.gc.cra.vartrunc.application.port.MetricsPort;
import ca.gc.cra.vartrunc.application.truncate.JsonSizeEstimator;
import ca.gc.cra.vartrunc.application.truncate.TruncationResult;
import ca.gc.cra.vartrunc.application.truncate.ValueTruncator;
import ca.gc.cra.vartrunc.config.OffloadConfig;
import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.execution.ExecutionField;
import ca.gc.cra.vartrunc.domain.execution.ExecutionOffload;
import ca.gc.cra.vartrunc.domain.execution.NodeExecution;
import ca.gc.cra.vartrunc.domain.segment.ObjectSegment;
import ca.gc.cra.vartrunc.domain.segment.StringSegment;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.Values;
import ca.gc.cra.vartrunc.validation.Strings;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides, per payload field, whether to keep it inline or upload it and keep a preview.
 * <p><strong>Why:</strong> Execution records must stay small while the full inputs and outputs remain
 * recoverable from blob storage.</p>
 * <p><strong>Role:</strong> Application service invoked by {@link NodeExecutionRepository#save(NodeExecution)}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Measure each field with {@link JsonSizeEstimator}; fields at or below the threshold stay as they are.</li>
 *   <li>Upload oversized inputs and outputs as sorted-key compact JSON and record the returned id.</li>
 *   <li>Replace oversized fields with a truncated preview carrying {@value #TRUNCATED_MARKER}, never larger than
 *   the threshold.</li>
 *   <li>Truncate oversized process data inline without uploading it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe when the injected ports are.</p>
 * <p><strong>Observability:</strong> Emits {@code offload.upload.success}, {@code offload.upload.failure},
 * {@code offload.upload.bytes} and {@code offload.field.inline}.</p>
 *
 * @since 0.1.0
 */
public final class OffloadCoordinator {
  /** Reserved key marking a truncated inline preview. */
  public static final String TRUNCATED_MARKER = "__truncated__";
  /** MIME type of uploaded payloads. */
  public static final String PAYLOAD_MIME_TYPE = "application/json";

  /** Bytes taken by {@code "__truncated__":true} plus one separating comma. */
  static final int MARKER_FOOTPRINT = JsonSizeEstimator.estimateString(TRUNCATED_MARKER) + 1 + 4 + 1;

  private static final Logger log = LoggerFactory.getLogger(OffloadCoordinator.class);

  private final OffloadConfig config;
  private final BlobStoragePort storage;
  private final MetricsPort metrics;
  private final ValueTruncator inlineTruncator;
  private final CompactJsonWriter writer = new CompactJsonWriter();

  /**
   * Creates a coordinator.
   *
   * @param config offload threshold
   * @param truncatorConfig limits for inline previews; its byte budget is replaced by the threshold minus the
   *     marker footprint
   * @param storage blob store receiving full payloads
   * @param metrics metrics sink
   */
  public OffloadCoordinator(
      OffloadConfig config, TruncatorConfig truncatorConfig, BlobStoragePort storage, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(truncatorConfig, "truncatorConfig");
    this.inlineTruncator = new ValueTruncator(
        truncatorConfig.withMaxSizeBytes(config.thresholdBytes() - MARKER_FOOTPRINT), metrics);
  }

  /**
   * Processes every payload field of {@code execution}.
   *
   * @param execution execution whose payloads are inspected
   * @return per-field decisions and the offload pointers
   * @throws BlobStorageException if an upload fails; no partial outcome is returned
   */
  public OffloadOutcome coordinate(NodeExecution execution) throws BlobStorageException {
    Objects.requireNonNull(execution, "execution");
    Map<ExecutionField, FieldOffload> fields = new EnumMap<>(ExecutionField.class);
    for (ExecutionField field : ExecutionField.values()) {
      fields.put(field, process(execution.id(), field, execution.payload(field)));
    }
    Optional<String> inputsFileId = fields.get(ExecutionField.INPUTS).fileId();
    Optional<String> outputsFileId = fields.get(ExecutionField.OUTPUTS).fileId();
    Optional<ExecutionOffload> offload = inputsFileId.isPresent() || outputsFileId.isPresent()
        ? Optional.of(new ExecutionOffload(execution.id(), inputsFileId, outputsFileId))
        : Optional.empty();
    return new OffloadOutcome(execution.id(), fields, offload);
  }

  /**
   * Truncates a mapping into an inline preview carrying the marker key.
   *
   * @param payload mapping to shorten
   * @return preview no larger than the threshold
   */
  public Map<String, Object> truncateWithMarker(Map<String, Object> payload) {
    Map<String, Object> withoutMarker = new LinkedHashMap<>(payload);
    withoutMarker.remove(TRUNCATED_MARKER);
    TruncationResult result = inlineTruncator.truncate(new ObjectSegment(Values.ofMap(withoutMarker)));
    Map<String, Object> preview;
    if (result.result() instanceof StringSegment text) {
      preview = new LinkedHashMap<>();
      preview.put(TRUNCATED_MARKER, text.text());
      return preview;
    }
    preview = Values.toJavaMap(((ObjectSegment) result.result()).value());
    preview.put(TRUNCATED_MARKER, Boolean.TRUE);
    return preview;
  }

  /**
   * Returns the configured threshold.
   *
   * @return threshold in bytes
   */
  public int thresholdBytes() {
    return config.thresholdBytes();
  }

  private FieldOffload process(String executionId, ExecutionField field, Optional<Map<String, Object>> payload)
      throws BlobStorageException {
    if (payload.isEmpty()) {
      return FieldOffload.absent(field);
    }
    ObjectValue value = Values.ofMap(payload.get());
    int size = JsonSizeEstimator.estimate(value);
    if (size <= config.thresholdBytes()) {
      metrics.increment("offload.field.inline");
      return FieldOffload.kept(field, payload.get());
    }

    Optional<String> fileId = Optional.empty();
    if (field.offloadable()) {
      fileId = Optional.of(upload(executionId, field, value));
    }
    Map<String, Object> preview = truncateWithMarker(payload.get());
    log.debug("Execution {} {} truncated from {} bytes (threshold {})",
        executionId, field.fieldName(), size, config.thresholdBytes());
    return new FieldOffload(field, Optional.of(preview), fileId, true);
  }

  private String upload(String executionId, ExecutionField field, ObjectValue value)
      throws BlobStorageException {
    byte[] content = writer.toSortedUtf8(value);
    String filename = blobFileName(executionId, field);
    String fileId;
    try {
      fileId = storage.upload(filename, content, PAYLOAD_MIME_TYPE);
    } catch (BlobStorageException ex) {
      metrics.increment("offload.upload.failure");
      log.warn("Upload of {} for execution {} failed", field.fieldName(), executionId);
      throw ex;
    }
    metrics.increment("offload.upload.success");
    metrics.observe("offload.upload.bytes", content.length);
    log.info("Offloaded {} of execution {} ({} bytes) as {}", field.fieldName(), executionId, content.length, fileId);
    return fileId;
  }

  static String blobFileName(String executionId, ExecutionField field) {
    String safeId = executionId.replaceAll("[^A-Za-z0-9._-]", "_");
    return Strings.requireFileName("filename", "node_execution_" + safeId + "_" + field.fieldName() + ".json");
  }
}
