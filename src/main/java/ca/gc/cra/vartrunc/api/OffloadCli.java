package ca.gc.cra.vartrunc.api;

import ca.gc.cra.vartrunc.application.json.CompactJsonWriter;
import ca.gc.cra.vartrunc.application.json.JsonSupport;
import ca.gc.cra.vartrunc.application.offload.NodeExecutionRepository;
import ca.gc.cra.vartrunc.application.offload.OffloadCoordinator;
import ca.gc.cra.vartrunc.application.port.BlobStorageException;
import ca.gc.cra.vartrunc.application.port.MetricsPort;
import ca.gc.cra.vartrunc.config.OffloadConfig;
import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.execution.ExecutionOffload;
import ca.gc.cra.vartrunc.domain.execution.NodeExecution;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionRecord;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionStatus;
import ca.gc.cra.vartrunc.domain.value.MaxDepthExceededException;
import ca.gc.cra.vartrunc.domain.value.Values;
import ca.gc.cra.vartrunc.infrastructure.persistence.InMemoryExecutionRecordAdapter;
import ca.gc.cra.vartrunc.infrastructure.storage.FileBlobStorageAdapter;
import ca.gc.cra.vartrunc.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the offload path for one node execution described by a JSON file.
 *
 * <p>Oversized inputs and outputs are written to the blob directory; the inline record is printed.</p>
 *
 * @since 0.1.0
 */
public final class OffloadCli {
  private static final Logger log = LoggerFactory.getLogger(OffloadCli.class);
  private static final String SECTION = "offload";
  private static final String NO_FILE = "-";
  private static final String SUMMARY_USAGE =
      "usage: offload in=FILE [config=FILE.yaml] [offloadThresholdBytes=N] [blobDirectory=DIR] "
          + "[stringLengthLimit=N] [arrayElementLimit=N] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      VARTRUNC offload

      Usage:
        offload in=./execution.json blobDirectory=./blobs [options]

      Required:
        in=FILE                    JSON object describing one node execution:
                                   {"id":..., "inputs":{...}, "outputs":{...}, "process_data":{...}}
                                   optional: workflowRunId, nodeId, nodeType, title, index, status

      Optional (validated):
        config=FILE.yaml           YAML file; 'common' and 'offload' sections apply
        offloadThresholdBytes=N    Size above which inputs/outputs are offloaded (default 10240, min 32)
        blobDirectory=DIR          Directory receiving offloaded payloads (default ./blobs)
        stringLengthLimit=N        Characters kept per string in inline previews (default 5000)
        arrayElementLimit=N        Elements kept per array in inline previews (default 100)
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Output:
        inputsFileId=ID|-, outputsFileId=ID|-, then the inline inputs, outputs and process_data.
      """;

  private OffloadCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for offload CLI");
    }

    Map<String, String> effective;
    try {
      input.requireNoWords();
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig(SECTION, kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid offload arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String in = effective.get("in");
    if (in == null || in.isBlank()) {
      log.error("Invalid offload arguments: in is required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path inputPath = Path.of(in).toAbsolutePath().normalize();
    if (!Files.isRegularFile(inputPath)) {
      log.error("Input file does not exist: {}", inputPath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    OffloadConfig offloadConfig;
    TruncatorConfig truncatorConfig;
    MetricsPort metrics;
    try {
      offloadConfig = OffloadConfig.fromMap(effective);
      truncatorConfig = TruncatorConfig.fromMap(effective);
      metrics = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid offload configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      NodeExecution execution =
          toExecution(new JsonSupport().parseObject(Files.readString(inputPath, StandardCharsets.UTF_8)));
      InMemoryExecutionRecordAdapter records = new InMemoryExecutionRecordAdapter();
      FileBlobStorageAdapter storage = new FileBlobStorageAdapter(offloadConfig.blobDirectory());
      NodeExecutionRepository repository = new NodeExecutionRepository(
          records, new OffloadCoordinator(offloadConfig, truncatorConfig, storage, metrics));
      repository.save(execution);
      NodeExecutionRecord record = records.findById(execution.id()).orElseThrow();
      log.info("Processed execution {} (threshold {} bytes, blobs under {})",
          execution.id(), offloadConfig.thresholdBytes(), storage.root());
      printRecord(record);
      return ExitCode.SUCCESS;
    } catch (MaxDepthExceededException ex) {
      log.error("Execution document {} is nested too deeply: {}", inputPath, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Execution document {} is invalid: {}", inputPath, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (BlobStorageException ex) {
      log.error("Blob upload failed for {}", inputPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Failed to read execution document {}", inputPath, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while offloading {}", inputPath, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.close(metrics);
    }
  }

  static NodeExecution toExecution(Map<String, Object> document) {
    Object id = document.get("id");
    if (!(id instanceof String executionId)) {
      throw new IllegalArgumentException("id must be a string");
    }
    NodeExecution execution = new NodeExecution(
        executionId,
        text(document, "workflowRunId", "cli"),
        text(document, "nodeId", "cli"),
        text(document, "nodeType", "cli"),
        text(document, "title", ""),
        index(document.get("index")),
        NodeExecutionStatus.fromString(text(document, "status", "succeeded")),
        Instant.now(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty());
    return execution.withPayloads(
        payload(document, "inputs"), payload(document, "outputs"), payload(document, "process_data"));
  }

  private static void printRecord(NodeExecutionRecord record) {
    Optional<ExecutionOffload> offload = record.offload();
    CompactJsonWriter writer = new CompactJsonWriter();
    CliPrinter.printLines(
        "inputsFileId=" + offload.flatMap(ExecutionOffload::inputsFileId).orElse(NO_FILE),
        "outputsFileId=" + offload.flatMap(ExecutionOffload::outputsFileId).orElse(NO_FILE),
        "inputs=" + record.inputs().map(map -> writer.write(Values.ofMap(map))).orElse("null"),
        "outputs=" + record.outputs().map(map -> writer.write(Values.ofMap(map))).orElse("null"),
        "process_data=" + record.processData().map(map -> writer.write(Values.ofMap(map))).orElse("null"));
  }

  private static String text(Map<String, Object> document, String key, String defaultValue) {
    Object value = document.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof String string)) {
      throw new IllegalArgumentException(key + " must be a string");
    }
    return string;
  }

  private static int index(Object raw) {
    if (raw == null) {
      return 0;
    }
    if (!(raw instanceof Long number) || number < 0 || number > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("index must be a non-negative integer");
    }
    return number.intValue();
  }

  private static Map<String, Object> payload(Map<String, Object> document, String key) {
    Object value = document.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(key + " must be a JSON object");
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String field)) {
        throw new IllegalArgumentException(key + " must only have string keys");
      }
      payload.put(field, entry.getValue());
    }
    return payload;
  }
}
