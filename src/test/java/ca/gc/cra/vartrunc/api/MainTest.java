package ca.gc.cra.vartrunc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
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

  @Test
  void helpWithoutCommandPrintsDispatcherHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("VARTRUNC command dispatcher"));
  }

  @Test
  void missingCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: vartrunc"));
  }

  @Test
  void unknownCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"compress"}));
    assertTrue(buffer.toString().contains("usage: vartrunc"));
  }

  @Test
  void forwardsFlagsToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"offload", "--help"}));
    assertTrue(buffer.toString().contains("VARTRUNC offload"));
  }

  @Test
  void dispatchesTruncate() throws IOException {
    Path doc = Files.writeString(tempDir.resolve("doc.json"), "\"plain\"");

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"TRUNCATE", "in=" + doc}));
    assertTrue(buffer.toString().startsWith("\"plain\""));
  }
}
