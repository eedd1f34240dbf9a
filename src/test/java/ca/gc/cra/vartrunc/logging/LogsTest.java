package ca.gc.cra.vartrunc.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @AfterEach
  void restoreRootLevel() {
    ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.WARN);
  }

  @Test
  void shortValuesAreReturnedAsIs() {
    assertEquals("abc", Logs.truncate("abc", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void longValuesAreClippedWithTotals() {
    assertEquals("abcd? (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void clippingNeverSplitsCodePoints() {
    String clipped = Logs.truncate("😀😀", 5);

    assertTrue(clipped.startsWith("😀?"));
    assertTrue(clipped.endsWith("(truncated, 5 of 8)"));
  }

  @Test
  void rejectsNonPositiveLimits() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void verboseLoggingRaisesRootToDebug() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertEquals(Level.DEBUG, root.getLevel());
    assertTrue(LoggingConfigurator.resetLogging());
    assertEquals(Level.INFO, root.getLevel());
  }
}
