package ca.gc.cra.vartrunc.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TruncatorConfigTest {

  @Test
  void defaultsMatchDocumentedLimits() {
    TruncatorConfig config = TruncatorConfig.defaults();

    assertEquals(5000, config.stringLengthLimit());
    assertEquals(100, config.arrayElementLimit());
    assertEquals(10_240, config.maxSizeBytes());
    assertEquals(1000, config.arrayItemCharLimit());
    assertEquals(5000, config.objectValueCharLimit());
  }

  @Test
  void rejectsLimitsThatCannotHoldAnEllipsis() {
    assertThrows(IllegalArgumentException.class, () -> TruncatorConfig.of(3, 100, 1000));
    assertThrows(IllegalArgumentException.class, () -> TruncatorConfig.of(10, 0, 1000));
    assertThrows(IllegalArgumentException.class, () -> TruncatorConfig.of(10, 100, 0));
  }

  @Test
  void maxSizeMustHoldAQuotedEllipsis() {
    assertThrows(IllegalArgumentException.class, () -> TruncatorConfig.of(10, 100, 4));
    assertEquals(TruncatorConfig.MIN_MAX_SIZE_BYTES, TruncatorConfig.of(10, 100, 5).maxSizeBytes());
  }

  @Test
  void fromMapParsesKnownKeysAndDefaultsTheRest() {
    TruncatorConfig config = TruncatorConfig.fromMap(Map.of("stringLengthLimit", "20", "maxSizeBytes", "256"));

    assertEquals(20, config.stringLengthLimit());
    assertEquals(256, config.maxSizeBytes());
    assertEquals(TruncatorConfig.DEFAULT_ARRAY_ELEMENT_LIMIT, config.arrayElementLimit());
  }

  @Test
  void fromMapRejectsNonNumericValues() {
    assertThrows(IllegalArgumentException.class,
        () -> TruncatorConfig.fromMap(Map.of("arrayElementLimit", "many")));
  }

  @Test
  void withMaxSizeBytesKeepsOtherLimits() {
    TruncatorConfig config = TruncatorConfig.of(20, 5, 100).withMaxSizeBytes(64);

    assertEquals(64, config.maxSizeBytes());
    assertEquals(20, config.stringLengthLimit());
    assertEquals(5, config.arrayElementLimit());
  }

  @Test
  void offloadConfigValidatesThreshold() {
    assertThrows(IllegalArgumentException.class, () -> new OffloadConfig(16, Path.of("blobs")));

    OffloadConfig config = OffloadConfig.fromMap(Map.of("offloadThresholdBytes", "2048", "blobDirectory", "out"));
    assertEquals(2048, config.thresholdBytes());
    assertEquals(Path.of("out"), config.blobDirectory());
    assertEquals(OffloadConfig.DEFAULT_THRESHOLD_BYTES, OffloadConfig.fromMap(Map.of()).thresholdBytes());
  }
}
