package ca.gc.cra.vartrunc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vartrunc.domain.execution.NodeExecution;
import ca.gc.cra.vartrunc.domain.execution.NodeExecutionStatus;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OffloadCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  private Map<String, String> outputFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    for (String line : buffer.toString().split("\\R")) {
      int idx = line.indexOf('=');
      if (idx > 0) {
        fields.put(line.substring(0, idx), line.substring(idx + 1));
      }
    }
    return fields;
  }

  @Test
  void oversizedInputsAreWrittenToBlobDirectory() throws IOException {
    Path blobs = tempDir.resolve("blobs");
    Path doc = Files.writeString(tempDir.resolve("execution.json"),
        "{\"id\":\"exec-9\",\"inputs\":{\"data\":\"" + "x".repeat(200) + "\"},\"outputs\":{\"ok\":true}}",
        StandardCharsets.UTF_8);

    ExitCode code = OffloadCli.run(new String[] {
        "in=" + doc, "offloadThresholdBytes=64", "blobDirectory=" + blobs});

    assertEquals(ExitCode.SUCCESS, code);
    Map<String, String> fields = outputFields();
    String inputsFileId = fields.get("inputsFileId");
    assertEquals("-", fields.get("outputsFileId"));
    assertTrue(fields.get("inputs").contains("\"__truncated__\":true"), fields.get("inputs"));
    assertTrue(fields.get("inputs").getBytes(StandardCharsets.UTF_8).length <= 64);
    assertEquals("{\"ok\":true}", fields.get("outputs"));
    assertEquals("null", fields.get("process_data"));

    Path blob = blobs.resolve(inputsFileId).resolve("node_execution_exec-9_inputs.json");
    assertEquals("{\"data\":\"" + "x".repeat(200) + "\"}", Files.readString(blob, StandardCharsets.UTF_8));
  }

  @Test
  void smallExecutionStaysInline() throws IOException {
    Path doc = Files.writeString(tempDir.resolve("execution.json"),
        "{\"id\":\"exec-1\",\"inputs\":{\"q\":\"hi\"}}", StandardCharsets.UTF_8);

    ExitCode code = OffloadCli.run(new String[] {"in=" + doc, "blobDirectory=" + tempDir.resolve("blobs")});

    assertEquals(ExitCode.SUCCESS, code);
    Map<String, String> fields = outputFields();
    assertEquals("-", fields.get("inputsFileId"));
    assertEquals("{\"q\":\"hi\"}", fields.get("inputs"));
    assertTrue(Files.notExists(tempDir.resolve("blobs")));
  }

  @Test
  void thresholdBelowMinimumReturnsInvalidArgs() throws IOException {
    Path doc = Files.writeString(tempDir.resolve("execution.json"), "{\"id\":\"e\"}");

    ExitCode code = OffloadCli.run(new String[] {"in=" + doc, "offloadThresholdBytes=8"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: offload"));
  }

  @Test
  void documentWithoutIdReturnsInvalidArgs() throws IOException {
    Path doc = Files.writeString(tempDir.resolve("execution.json"), "{\"inputs\":{}}");

    ExitCode code = OffloadCli.run(new String[] {"in=" + doc, "blobDirectory=" + tempDir});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void toExecutionAppliesDefaults() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("id", "exec-2");
    document.put("index", 4L);
    document.put("process_data", Map.of("step", "done"));

    NodeExecution execution = OffloadCli.toExecution(document);

    assertEquals("cli", execution.workflowRunId());
    assertEquals(4, execution.index());
    assertEquals(NodeExecutionStatus.SUCCEEDED, execution.status());
    assertTrue(execution.inputs().isEmpty());
    assertEquals("done", execution.processData().orElseThrow().get("step"));
  }

  @Test
  void toExecutionRejectsNonObjectPayload() {
    Map<String, Object> document = Map.of("id", "exec-3", "inputs", "text");

    assertThrows(IllegalArgumentException.class, () -> OffloadCli.toExecution(document));
  }

  @Test
  void toExecutionRejectsPayloadWithNonStringKeys() {
    Map<Object, Object> inputs = new HashMap<>();
    inputs.put(7, "seven");
    Map<String, Object> document = Map.of("id", "exec-4", "inputs", inputs);

    assertThrows(IllegalArgumentException.class, () -> OffloadCli.toExecution(document));
  }
}
