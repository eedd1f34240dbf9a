package ca.gc.cra.vartrunc.application.truncate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.domain.value.Value;
import ca.gc.cra.vartrunc.domain.value.Values;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContainerTruncatorTest {

  private static ArrayValue integers(int count) {
    List<Value> items = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      items.add(IntegerValue.of(i));
    }
    return new ArrayValue(items);
  }

  private static ObjectValue twentyKeysReversed() {
    Map<String, Object> raw = new LinkedHashMap<>();
    for (int i = 19; i >= 0; i--) {
      raw.put("key" + i, "value" + i);
    }
    return Values.ofMap(raw);
  }

  @Test
  void arrayIsCappedAtElementLimit() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.of(100, 3, 1000));

    TruncationPart part = truncator.truncateArray(integers(6), 1000);

    assertEquals(integers(3), part.value());
    assertEquals(7, part.size());
    assertTrue(part.truncated());
  }

  @Test
  void arrayWithinLimitsIsUnchanged() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.of(100, 10, 1000));
    ArrayValue array = integers(4);

    TruncationPart part = truncator.truncateArray(array, 1000);

    assertSame(array, part.value());
    assertFalse(part.truncated());
  }

  @Test
  void arrayOfLongStringsFitsByteBudget() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.of(5000, 100, 50));
    List<Value> items = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      items.add(StringValue.of("a".repeat(100)));
    }

    TruncationPart part = truncator.truncateArray(new ArrayValue(items), 50);

    assertTrue(part.size() <= 50);
    assertEquals(JsonSizeEstimator.estimate(part.value()), part.size());
    assertTrue(part.truncated());
    for (Value item : ((ArrayValue) part.value()).items()) {
      assertTrue(((StringValue) item).value().endsWith(StringTruncator.ELLIPSIS));
    }
  }

  @Test
  void arrayKeepsPrefixInOriginalOrder() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.of(5000, 100, 20));

    TruncationPart part = truncator.truncateArray(integers(50), 20);

    ArrayValue kept = (ArrayValue) part.value();
    for (int i = 0; i < kept.size(); i++) {
      assertEquals(IntegerValue.of(i + 1), kept.get(i));
    }
    assertTrue(part.size() <= 20);
  }

  @Test
  void objectOverBudgetKeepsFewerSortedKeys() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.of(5000, 100, 50));
    ObjectValue object = twentyKeysReversed();

    TruncationPart part = truncator.truncateObject(object, 50);

    ObjectValue kept = (ObjectValue) part.value();
    List<String> keys = List.copyOf(kept.entries().keySet());
    assertTrue(keys.size() < 20);
    assertEquals(object.sortedKeys().subList(0, keys.size()), keys);
    assertTrue(part.size() <= 50);
    assertEquals(JsonSizeEstimator.estimate(kept), part.size());
    assertTrue(part.truncated());
  }

  @Test
  void objectThatFitsIsUnchanged() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.defaults());
    ObjectValue object = Values.ofMap(Map.of("b", 1, "a", "x"));

    TruncationPart part = truncator.truncateObject(object, 100);

    assertSame(object, part.value());
    assertFalse(part.truncated());
  }

  @Test
  void nestedContainersShareTheBudget() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.of(5000, 100, 60));
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("items", List.of("x".repeat(40), "y".repeat(40), "z".repeat(40)));
    raw.put("meta", Map.of("note", "n".repeat(80)));

    TruncationPart part = truncator.truncateObject(Values.ofMap(raw), 60);

    assertTrue(part.size() <= 60);
    assertEquals(JsonSizeEstimator.estimate(part.value()), part.size());
  }

  @Test
  void arrayItemsRespectArrayCharCeiling() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.defaults());

    TruncationPart part = truncator.truncateItemToBudget(StringValue.of("a".repeat(2000)), 100_000);

    StringValue item = (StringValue) part.value();
    assertEquals(TruncatorConfig.ARRAY_CHAR_LIMIT, item.codePointLength());
    assertTrue(item.value().endsWith(StringTruncator.ELLIPSIS));
  }

  @Test
  void objectValuesRespectObjectCharCeiling() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.defaults());

    TruncationPart part = truncator.truncateValueToBudget(StringValue.of("b".repeat(6000)), 100_000);

    assertEquals(TruncatorConfig.OBJECT_CHAR_LIMIT, ((StringValue) part.value()).codePointLength());
  }

  @Test
  void oversizedAtomicBecomesShortenedText() {
    ContainerTruncator truncator = new ContainerTruncator(TruncatorConfig.defaults());

    TruncationPart part = truncator.truncateItemToBudget(IntegerValue.of(1234567890123L), 8);

    assertEquals(StringValue.of("123..."), part.value());
    assertTrue(part.truncated());
  }
}
