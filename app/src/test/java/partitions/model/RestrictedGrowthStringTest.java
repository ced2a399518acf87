package partitions.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import partitions.core.InvalidRequestException;

final class RestrictedGrowthStringTest {

  @Test
  void acceptsValidStringsAndCountsBlocks() {
    RestrictedGrowthString rgs = RestrictedGrowthString.of(0, 0, 1, 0, 2);
    assertEquals(5, rgs.length());
    assertEquals(3, rgs.blockCount());
    assertEquals(1, rgs.label(3));
    assertEquals(List.of(0, 0, 1, 0, 2), rgs.toList());
  }

  @Test
  void rejectsStringsThatBreakTheGrowthRule() {
    assertThrows(InvalidRequestException.class, () -> RestrictedGrowthString.of(1, 0));
    assertThrows(InvalidRequestException.class, () -> RestrictedGrowthString.of(0, 2));
    assertThrows(InvalidRequestException.class, () -> RestrictedGrowthString.of(0, 1, 3));
    assertThrows(InvalidRequestException.class, () -> RestrictedGrowthString.of(0, -1));
  }

  @Test
  void emptyStringEncodesTheEmptyPartition() {
    RestrictedGrowthString empty = RestrictedGrowthString.of();
    assertSame(RestrictedGrowthString.empty(), empty);
    assertTrue(empty.isEmpty());
    assertEquals(0, empty.blockCount());
  }

  @Test
  void positionsAreOneBased() {
    RestrictedGrowthString rgs = RestrictedGrowthString.of(0, 1);
    assertEquals(0, rgs.label(1));
    assertThrows(IndexOutOfBoundsException.class, () -> rgs.label(0));
    assertThrows(IndexOutOfBoundsException.class, () -> rgs.label(3));
  }

  @Test
  void copiesAreDefensive() {
    int[] labels = {0, 1, 1};
    RestrictedGrowthString rgs = RestrictedGrowthString.of(labels);
    labels[2] = 0;
    rgs.toArray()[1] = 0;
    assertArrayEquals(new int[] {0, 1, 1}, rgs.toArray());
  }

  @Test
  void ordersLexicographicallyAndComparesByValue() {
    RestrictedGrowthString a = RestrictedGrowthString.of(0, 0, 1);
    RestrictedGrowthString b = RestrictedGrowthString.of(0, 1, 0);
    assertTrue(a.compareTo(b) < 0);
    assertEquals(a, RestrictedGrowthString.of(List.of(0, 0, 1)));
    assertEquals(a.hashCode(), RestrictedGrowthString.of(0, 0, 1).hashCode());
    assertNotEquals(a, b);
    assertEquals("[0, 0, 1]", a.toString());
  }
}
