package ca.gc.cra.vartrunc.application.truncate;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class BudgetAllocatorTest {

  @Test
  void smallDemandsAreMetAndTheRestSplitEvenly() {
    assertArrayEquals(new int[] {45, 10, 45}, BudgetAllocator.distribute(new int[] {100, 10, 100}, 100));
  }

  @Test
  void allocationNeverExceedsDemand() {
    assertArrayEquals(new int[] {5, 5}, BudgetAllocator.distribute(new int[] {5, 5}, 100));
  }

  @Test
  void allocationNeverExceedsAvailable() {
    int[] allocation = BudgetAllocator.distribute(new int[] {7, 31, 12, 90, 3}, 61);

    assertTrue(Arrays.stream(allocation).sum() <= 61);
  }

  @Test
  void emptyAndNegativeInputs() {
    assertEquals(0, BudgetAllocator.distribute(new int[0], 10).length);
    assertArrayEquals(new int[] {0, 0}, BudgetAllocator.distribute(new int[] {4, 4}, -3));
  }

  @Test
  void minimumSizeIsAnEllipsisOrAnEmptyContainer() {
    assertEquals(5, BudgetAllocator.minimumSize(StringValue.of("hello")));
    assertEquals(4, BudgetAllocator.minimumSize(StringValue.of("ab")));
    assertEquals(3, BudgetAllocator.minimumSize(IntegerValue.of(123)));
    assertEquals(5, BudgetAllocator.minimumSize(IntegerValue.of(123456)));
    assertEquals(2, BudgetAllocator.minimumSize(ArrayValue.of(IntegerValue.of(1), IntegerValue.of(2))));
    assertEquals(2, BudgetAllocator.minimumSize(ObjectValue.EMPTY));
  }
}
