package ca.gc.cra.vartrunc.application.truncate;

import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.BooleanValue;
import ca.gc.cra.vartrunc.domain.value.FloatValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.domain.value.Value;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Truncates arrays and objects to a byte budget, recursing into their children.
 * <p><strong>Why:</strong> Containers shrink by dropping trailing elements or trailing sorted keys first and by
 * shortening children second, so the structure a reader sees stays recognizable.</p>
 * <p><strong>Role:</strong> Leaf truncator used by {@link ValueTruncator}; budgets are split by
 * {@link BudgetAllocator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Arrays keep a prefix of at most {@code arrayElementLimit} elements, in their original order.</li>
 *   <li>Objects keep a prefix of their lexicographically sorted keys and emit keys in that order.</li>
 *   <li>Children receive a share of the budget; unused share carries over to later children.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Performance:</strong> Child sizes are estimated once per level; nested containers are re-measured as
 * they are visited, so deep payloads cost O(depth &times; nodes).</p>
 * <p><strong>Observability:</strong> Logs dropped elements and keys at DEBUG.</p>
 *
 * @implNote For any budget of at least two bytes the returned value fits the budget.
 * @since 0.1.0
 */
public final class ContainerTruncator {
  private static final Logger log = LoggerFactory.getLogger(ContainerTruncator.class);

  private final TruncatorConfig config;
  private final int itemCharCeiling;
  private final int valueCharCeiling;

  /**
   * Creates a container truncator.
   *
   * @param config limits to apply
   */
  public ContainerTruncator(TruncatorConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.itemCharCeiling = Math.min(config.arrayItemCharLimit(), config.stringLengthLimit());
    this.valueCharCeiling = Math.min(config.objectValueCharLimit(), config.stringLengthLimit());
  }

  /**
   * Truncates an array to {@code budget} bytes.
   *
   * @param array array to shorten
   * @param budget compact-JSON byte budget
   * @return the array unchanged when it fits and is within the element limit, otherwise a shortened prefix
   */
  public TruncationPart truncateArray(ArrayValue array, int budget) {
    int size = JsonSizeEstimator.estimate(array);
    if (array.size() <= config.arrayElementLimit() && size <= budget) {
      return TruncationPart.unchanged(array, size);
    }

    int keep = Math.min(array.size(), config.arrayElementLimit());
    int[] sizes = new int[keep];
    long minimal = 0;
    int[] minimums = new int[keep];
    for (int i = 0; i < keep; i++) {
      sizes[i] = JsonSizeEstimator.estimate(array.get(i));
      minimums[i] = BudgetAllocator.minimumSize(array.get(i), sizes[i]);
      minimal += minimums[i];
    }
    while (keep > 0 && 2L + (keep - 1) + minimal > budget) {
      keep--;
      minimal -= minimums[keep];
    }
    if (keep == 0) {
      return new TruncationPart(ArrayValue.EMPTY, 2, array.size() > 0);
    }

    int available = budget - 2 - (keep - 1);
    int[] shares = BudgetAllocator.distribute(Arrays.copyOf(sizes, keep), available);
    List<Value> kept = new ArrayList<>(keep);
    boolean truncated = keep < array.size();
    int used = 0;
    int slack = 0;
    for (int i = 0; i < keep; i++) {
      int share = shares[i] + slack;
      TruncationPart part = truncateItemToBudget(array.get(i), share);
      if (part.size() > share) {
        truncated = true;
        break;
      }
      kept.add(part.value());
      used += part.size();
      slack = share - part.size();
      truncated |= part.truncated();
    }
    if (kept.size() < array.size()) {
      log.debug("Array shortened from {} to {} elements (budget {} bytes)", array.size(), kept.size(), budget);
    }
    return new TruncationPart(new ArrayValue(kept), 2 + used + Math.max(kept.size() - 1, 0), truncated);
  }

  /**
   * Truncates an object to {@code budget} bytes.
   *
   * @param object object to shorten
   * @param budget compact-JSON byte budget
   * @return the object unchanged when it fits, otherwise a mapping over a prefix of its sorted keys
   */
  public TruncationPart truncateObject(ObjectValue object, int budget) {
    int size = JsonSizeEstimator.estimate(object);
    if (size <= budget) {
      return TruncationPart.unchanged(object, size);
    }

    List<String> keys = object.sortedKeys();
    int[] keyCosts = new int[keys.size()];
    int[] sizes = new int[keys.size()];
    long fixed = 2;
    long minimal = 0;
    int keep = 0;
    for (String key : keys) {
      Value value = object.get(key);
      int keyCost = JsonSizeEstimator.estimateString(key) + 1;
      int valueSize = JsonSizeEstimator.estimate(value);
      int minimum = BudgetAllocator.minimumSize(value, valueSize);
      long structure = fixed + (keep > 0 ? 1 : 0) + keyCost;
      if (structure + minimal + minimum > budget) {
        break;
      }
      fixed = structure;
      minimal += minimum;
      keyCosts[keep] = keyCost;
      sizes[keep] = valueSize;
      keep++;
    }

    int available = (int) (budget - fixed);
    int[] shares = BudgetAllocator.distribute(Arrays.copyOf(sizes, keep), available);
    Map<String, Value> kept = new LinkedHashMap<>();
    int used = 2;
    int slack = 0;
    for (int i = 0; i < keep; i++) {
      String key = keys.get(i);
      int share = shares[i] + slack;
      TruncationPart part = truncateValueToBudget(object.get(key), share);
      if (part.size() > share) {
        slack = share;
        continue;
      }
      used += (kept.isEmpty() ? 0 : 1) + keyCosts[i] + part.size();
      kept.put(key, part.value());
      slack = share - part.size();
    }
    log.debug("Object shortened from {} to {} keys (budget {} bytes)", object.size(), kept.size(), budget);
    return new TruncationPart(new ObjectValue(kept), used, true);
  }

  /**
   * Truncates an array element to {@code budget} bytes. Strings are also capped at
   * {@code min(arrayItemCharLimit, stringLengthLimit)} code points.
   *
   * @param item array element
   * @param budget byte budget for the element
   * @return shaped element
   */
  public TruncationPart truncateItemToBudget(Value item, int budget) {
    return truncateChild(item, budget, itemCharCeiling);
  }

  /**
   * Truncates an object value to {@code budget} bytes. Strings are also capped at
   * {@code min(objectValueCharLimit, stringLengthLimit)} code points.
   *
   * @param value object value
   * @param budget byte budget for the value
   * @return shaped value
   */
  public TruncationPart truncateValueToBudget(Value value, int budget) {
    return truncateChild(value, budget, valueCharCeiling);
  }

  private TruncationPart truncateChild(Value value, int budget, int charCeiling) {
    return switch (value.kind()) {
      case STRING -> StringTruncator.shape((StringValue) value, charCeiling, budget);
      case ARRAY -> truncateArray((ArrayValue) value, budget);
      case OBJECT -> truncateObject((ObjectValue) value, budget);
      case INTEGER, FLOAT, BOOLEAN, NULL -> {
        int size = JsonSizeEstimator.estimate(value);
        if (size <= budget) {
          yield TruncationPart.unchanged(value, size);
        }
        TruncationPart text = StringTruncator.shape(StringValue.of(atomicText(value)), charCeiling, budget);
        yield new TruncationPart(text.value(), text.size(), true);
      }
    };
  }

  private static String atomicText(Value value) {
    return switch (value.kind()) {
      case INTEGER -> Long.toString(((IntegerValue) value).value());
      case FLOAT -> Double.toString(((FloatValue) value).value());
      case BOOLEAN -> Boolean.toString(((BooleanValue) value).value());
      case NULL -> "null";
      default -> throw new IllegalArgumentException("Not an atomic value: " + value.kind());
    };
  }
}
