package ca.gc.cra.vartrunc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class TruncateCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(TruncateCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  private Path document(String json) throws IOException {
    return Files.writeString(tempDir.resolve("doc.json"), json, StandardCharsets.UTF_8);
  }

  private String[] outputLines() {
    return buffer.toString().split("\\R");
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = TruncateCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("VARTRUNC truncate"));
  }

  @Test
  void missingInputReturnsInvalidArgs() {
    ExitCode code = TruncateCli.run(new String[] {"maxSizeBytes=40"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: truncate"));
    assertTrue(loggedError("in is required"));
  }

  @Test
  void nonexistentInputReturnsInvalidArgs() {
    ExitCode code = TruncateCli.run(new String[] {"in=" + tempDir.resolve("missing.json")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("does not exist"));
  }

  @Test
  void invalidLimitReturnsInvalidArgs() throws IOException {
    Path doc = document("{}");

    ExitCode code = TruncateCli.run(new String[] {"in=" + doc, "stringLengthLimit=2"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("stringLengthLimit"));
  }

  @Test
  void smallDocumentIsPrintedUnchanged() throws IOException {
    Path doc = document("{ \"b\": [1, 2.5, true, null], \"a\": \"hi\" }");

    ExitCode code = TruncateCli.run(new String[] {"in=" + doc});

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = outputLines();
    assertEquals("{\"b\":[1,2.5,true,null],\"a\":\"hi\"}", lines[0]);
    assertEquals("truncated=false", lines[1]);
  }

  @Test
  void oversizedDocumentIsShortenedToBudget() throws IOException {
    Path doc = document("{\"name\":\"" + "x".repeat(100) + "\"}");

    ExitCode code = TruncateCli.run(new String[] {"in=" + doc, "maxSizeBytes=40"});

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = outputLines();
    assertTrue(lines[0].startsWith("{\"name\":\"xxx"), lines[0]);
    assertTrue(lines[0].endsWith("...\"}"), lines[0]);
    assertTrue(lines[0].getBytes(StandardCharsets.UTF_8).length <= 40);
    assertEquals("truncated=true", lines[1]);
  }

  @Test
  void yamlConfigurationAppliesAndCliOverrides() throws IOException {
    Path doc = document("[\"a\",\"b\",\"c\",\"d\"]");
    Path yaml = Files.writeString(tempDir.resolve("vartrunc.yaml"), """
        truncate:
          arrayElementLimit: 2
        """);

    ExitCode fromYaml = TruncateCli.run(new String[] {"in=" + doc, "config=" + yaml});

    assertEquals(ExitCode.SUCCESS, fromYaml);
    assertEquals("[\"a\",\"b\"]", outputLines()[0]);

    buffer.getBuffer().setLength(0);
    ExitCode overridden = TruncateCli.run(new String[] {"in=" + doc, "config=" + yaml, "arrayElementLimit=3"});

    assertEquals(ExitCode.SUCCESS, overridden);
    assertEquals("[\"a\",\"b\",\"c\"]", outputLines()[0]);
  }

  @Test
  void missingYamlFileReturnsInvalidArgs() throws IOException {
    Path doc = document("{}");

    ExitCode code = TruncateCli.run(new String[] {"in=" + doc, "config=" + tempDir.resolve("none.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Configuration file does not exist"));
  }

  @Test
  void malformedJsonReturnsInvalidArgs() throws IOException {
    Path doc = document("{\"a\": ");

    ExitCode code = TruncateCli.run(new String[] {"in=" + doc});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("not valid JSON"));
  }
}
