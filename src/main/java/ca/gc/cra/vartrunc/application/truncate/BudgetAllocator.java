package ca.gc.cra.vartrunc.application.truncate;

import ca.gc.cra.vartrunc.domain.value.Value;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Splits a byte budget across the children of a container.
 *
 * <p>Allocation is max-min fair: children that need less than an even share receive exactly what they need and
 * the remainder is spread evenly over the larger ones. As long as the budget covers every child's
 * {@linkplain #minimumSize(Value) minimum size}, each child is allotted at least that minimum.</p>
 *
 * @since 0.1.0
 */
public final class BudgetAllocator {
  private BudgetAllocator() {
    // Utility
  }

  /**
   * Distributes {@code available} bytes over the given demands.
   *
   * @param demands bytes each child would need to stay unchanged; non-negative
   * @param available bytes to share; negative values are treated as zero
   * @return allocation per child, in the order of {@code demands}; never more than the demand, summing to at most
   *     {@code available}
   */
  public static int[] distribute(int[] demands, int available) {
    int count = demands.length;
    int[] allocation = new int[count];
    if (count == 0) {
      return allocation;
    }
    Integer[] order = IntStream.range(0, count).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingInt(i -> demands[i]));
    long remaining = Math.max(available, 0);
    for (int position = 0; position < count; position++) {
      int child = order[position];
      long share = remaining / (count - position);
      int granted = (int) Math.min(Math.max(demands[child], 0), share);
      allocation[child] = granted;
      remaining -= granted;
    }
    return allocation;
  }

  /**
   * Returns the smallest size {@code value} can be shaped into by the container truncators.
   *
   * <p>Strings and atomics can always become a quoted ellipsis; containers can always become empty.</p>
   *
   * @param value value to inspect
   * @return minimum size in bytes, never above the value's current size
   */
  public static int minimumSize(Value value) {
    return minimumSize(value, JsonSizeEstimator.estimate(value));
  }

  static int minimumSize(Value value, int size) {
    int floor = value.kind().isContainer() ? 2 : StringTruncator.MIN_MARKED_BYTES;
    return Math.min(size, floor);
  }
}
