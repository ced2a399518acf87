package partitions.enumeration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import partitions.core.InvalidRequestException;
import partitions.core.StirlingNumbers;
import partitions.model.RestrictedGrowthString;
import partitions.model.SetPartition;

final class PartitionEnumeratorTest {
  private final PartitionEnumerator enumerator = new PartitionEnumerator(new StirlingNumbers());

  @Test
  void allModeVisitsBellManyStringsInIncreasingOrder() {
    long[] bell = {1, 1, 2, 5, 15, 52, 203, 877, 4140};
    for (int n = 0; n < bell.length; n++) {
      List<RestrictedGrowthString> all = walk(enumerator.first(n, Mode.ALL));
      assertEquals(bell[n], all.size(), "Bell(" + n + ")");
      assertEquals(BigInteger.valueOf(bell[n]), enumerator.count(n, Mode.ALL));
      assertStrictlyIncreasing(all);
      assertEquals(all.size(), new HashSet<>(all).size(), "duplicates for n=" + n);
      for (RestrictedGrowthString rgs : all) {
        assertEquals(n, rgs.length());
        assertValidGrowth(rgs);
      }
    }
  }

  @Test
  void exactModeVisitsStirlingManyStringsWithKBlocks() {
    StirlingNumbers numbers = new StirlingNumbers();
    for (int n = 1; n <= 8; n++) {
      for (int k = 1; k <= n; k++) {
        List<RestrictedGrowthString> exact = walk(enumerator.first(n, Mode.EXACT_K, k));
        assertEquals(
            numbers.stirling(n, k).longValueExact(), exact.size(), "S(" + n + "," + k + ")");
        assertEquals(numbers.stirling(n, k), enumerator.count(n, Mode.EXACT_K, k));
        assertStrictlyIncreasing(exact);
        for (RestrictedGrowthString rgs : exact) {
          assertValidGrowth(rgs);
          assertEquals(k, rgs.blockCount(), rgs + " in S(" + n + "," + k + ")");
        }
      }
    }
  }

  @Test
  void exactModeIsTheKBlockSliceOfAllMode() {
    int n = 6;
    List<RestrictedGrowthString> all = walk(enumerator.first(n, Mode.ALL));
    for (int k = 1; k <= n; k++) {
      int blocks = k;
      List<RestrictedGrowthString> filtered =
          all.stream().filter(rgs -> rgs.blockCount() == blocks).collect(Collectors.toList());
      assertEquals(filtered, walk(enumerator.first(n, Mode.EXACT_K, k)), "k=" + k);
    }
  }

  @Test
  void firstAndLastStrings() {
    assertEquals(RestrictedGrowthString.of(0, 0, 0, 0), enumerator.first(4, Mode.ALL).current());
    assertEquals(
        RestrictedGrowthString.of(0, 0, 0, 1, 2), enumerator.first(5, Mode.EXACT_K, 3).current());
    assertEquals(RestrictedGrowthString.of(0, 1, 2, 3), last(walk(enumerator.first(4, Mode.ALL))));
    assertEquals(
        RestrictedGrowthString.of(0, 1, 2, 2, 2),
        last(walk(enumerator.first(5, Mode.EXACT_K, 3))));
    assertEquals(
        List.of(
            RestrictedGrowthString.of(0, 0, 0, 1),
            RestrictedGrowthString.of(0, 0, 1, 0),
            RestrictedGrowthString.of(0, 0, 1, 1),
            RestrictedGrowthString.of(0, 1, 0, 0),
            RestrictedGrowthString.of(0, 1, 0, 1),
            RestrictedGrowthString.of(0, 1, 1, 0),
            RestrictedGrowthString.of(0, 1, 1, 1)),
        walk(enumerator.first(4, Mode.EXACT_K, 2)));
  }

  @Test
  void nextThenPreviousReturnsToTheSameString() {
    for (PartitionRequest request :
        List.of(
            PartitionRequest.all(5),
            PartitionRequest.exactly(6, 3),
            PartitionRequest.exactly(5, 1))) {
      EnumerationCursor cursor = enumerator.first(request);
      while (true) {
        RestrictedGrowthString before = cursor.current();
        BigInteger position = cursor.position();
        Optional<RestrictedGrowthString> next = enumerator.next(cursor);
        if (next.isEmpty()) {
          break;
        }
        assertEquals(Optional.of(before), enumerator.previous(cursor));
        assertEquals(position, cursor.position());
        enumerator.next(cursor);
      }
    }
  }

  @Test
  void previousWalksTheReverseOrder() {
    PartitionRequest request = PartitionRequest.exactly(6, 3);
    List<RestrictedGrowthString> forward = walk(enumerator.first(request));
    EnumerationCursor cursor = enumerator.seek(request, forward.size() - 1);
    List<RestrictedGrowthString> backward = new ArrayList<>();
    backward.add(cursor.current());
    for (Optional<RestrictedGrowthString> prev = enumerator.previous(cursor);
        prev.isPresent();
        prev = enumerator.previous(cursor)) {
      backward.add(prev.get());
    }
    List<RestrictedGrowthString> reversed = new ArrayList<>(forward);
    Collections.reverse(reversed);
    assertEquals(reversed, backward);
    assertEquals(BigInteger.ZERO, cursor.position());
  }

  @Test
  void endsOfTheEnumerationReturnEmptyAndKeepTheCursor() {
    EnumerationCursor cursor = enumerator.first(3, Mode.ALL);
    assertEquals(Optional.empty(), enumerator.previous(cursor));
    assertEquals(RestrictedGrowthString.of(0, 0, 0), cursor.current());

    while (enumerator.next(cursor).isPresent()) {
      assertFalse(cursor.isExhausted());
    }
    assertTrue(cursor.isExhausted());
    assertEquals(RestrictedGrowthString.of(0, 1, 2), cursor.current());
    assertEquals(Optional.empty(), enumerator.next(cursor));
    assertEquals(BigInteger.valueOf(4), cursor.position());

    assertEquals(Optional.of(RestrictedGrowthString.of(0, 1, 1)), enumerator.previous(cursor));
    assertFalse(cursor.isExhausted());
  }

  @Test
  void emptySetHasExactlyTheEmptyPartition() {
    EnumerationCursor cursor = enumerator.first(0, Mode.ALL);
    assertTrue(cursor.current().isEmpty());
    assertEquals(0, cursor.blockCount());
    assertEquals(Optional.empty(), enumerator.next(cursor));
    assertEquals(Optional.empty(), enumerator.previous(cursor));
    assertEquals(BigInteger.ONE, enumerator.count(0, Mode.ALL));

    EnumerationCursor exact = enumerator.first(0, Mode.EXACT_K, 0);
    assertTrue(exact.current().isEmpty());
    assertEquals(BigInteger.ONE, enumerator.count(0, Mode.EXACT_K, 0));
    assertEquals("{ }", PartitionEnumerator.blocksOf(exact.current()).format());
  }

  @Test
  void countsFollowTheRequestBounds() {
    for (int n = 0; n <= 7; n++) {
      PartitionRequest all = PartitionRequest.all(n);
      assertEquals(new RgsRanking(all).total(), enumerator.count(all), all.toString());
      for (int k = n == 0 ? 0 : 1; k <= n; k++) {
        PartitionRequest exact = PartitionRequest.exactly(n, k);
        assertEquals(new RgsRanking(exact).total(), enumerator.count(exact), exact.toString());
      }
    }
  }

  @Test
  void largeRequestsCountAndSummarize() {
    PartitionEnumerator fresh = new PartitionEnumerator(new StirlingNumbers());
    BigInteger expected = BigInteger.valueOf(4_999_950_000L);
    assertEquals(expected, fresh.count(100_000, Mode.EXACT_K, 99_999));

    EnumerationCursor cursor = fresh.first(100_000, Mode.EXACT_K, 99_999);
    PartitionSummary summary = fresh.summarize(cursor);
    assertEquals(expected, summary.total());
    assertEquals(99_999, summary.blockCount());
    assertTrue(summary.isFirst());
  }

  @Test
  void invalidRequestsFailAtFirst() {
    assertThrows(InvalidRequestException.class, () -> enumerator.first(3, Mode.EXACT_K, 0));
    assertThrows(InvalidRequestException.class, () -> enumerator.first(3, Mode.EXACT_K, 4));
    assertThrows(InvalidRequestException.class, () -> enumerator.first(3, Mode.EXACT_K, -1));
    assertThrows(InvalidRequestException.class, () -> enumerator.first(0, Mode.EXACT_K, 1));
    assertThrows(InvalidRequestException.class, () -> enumerator.first(-1, Mode.ALL));
    assertThrows(InvalidRequestException.class, () -> enumerator.first(3, Mode.EXACT_K));
    assertThrows(InvalidRequestException.class, () -> enumerator.count(2, Mode.EXACT_K, 3));
    assertThrows(InvalidRequestException.class, () -> new PartitionRequest(2, null, 0));
  }

  @Test
  void allModeIgnoresTheBlockCount() {
    PartitionRequest request = new PartitionRequest(4, Mode.ALL, 9);
    assertEquals(0, request.k());
    assertEquals(new BlockBounds(1, 4), request.bounds());
    assertEquals(BlockBounds.exactly(2), PartitionRequest.exactly(4, 2).bounds());
  }

  @Test
  void blocksOfFollowsLabelOrder() {
    SetPartition partition = PartitionEnumerator.blocksOf(RestrictedGrowthString.of(0, 1, 0, 2, 1));
    assertEquals(List.of(1, 3), partition.block(0).elements());
    assertEquals(List.of(2, 5), partition.block(1).elements());
    assertEquals(List.of(4), partition.block(2).elements());
  }

  @Test
  void summaryReportsPositionOutOfTotal() {
    EnumerationCursor cursor = enumerator.first(4, Mode.EXACT_K, 2);
    enumerator.next(cursor);
    enumerator.next(cursor);
    PartitionSummary summary = enumerator.summarize(cursor);
    assertEquals(BigInteger.valueOf(3), summary.ordinal());
    assertEquals(BigInteger.valueOf(7), summary.total());
    assertEquals(RestrictedGrowthString.of(0, 0, 1, 1), summary.rgs());
    assertEquals(List.of(2, 2), summary.blockSizes());
    assertFalse(summary.isFirst());
    assertFalse(summary.isLast());
  }

  @Test
  void streamsMatchStepwiseEnumeration() {
    PartitionRequest request = PartitionRequest.all(5);
    assertEquals(walk(enumerator.first(request)), enumerator.stream(request).toList());
    assertEquals(3, enumerator.stream(request).limit(3).count());
    assertEquals(
        List.of("{ {1, 2, 3}, {4} }", "{ {1, 2, 4}, {3} }"),
        enumerator.partitions(PartitionRequest.exactly(4, 2)).limit(2).map(SetPartition::format)
            .toList());
  }

  private List<RestrictedGrowthString> walk(EnumerationCursor cursor) {
    List<RestrictedGrowthString> visited = new ArrayList<>();
    visited.add(cursor.current());
    for (Optional<RestrictedGrowthString> next = enumerator.next(cursor);
        next.isPresent();
        next = enumerator.next(cursor)) {
      visited.add(next.get());
    }
    return visited;
  }

  private static RestrictedGrowthString last(List<RestrictedGrowthString> list) {
    return list.get(list.size() - 1);
  }

  private static void assertStrictlyIncreasing(List<RestrictedGrowthString> list) {
    for (int i = 1; i < list.size(); i++) {
      assertTrue(
          list.get(i - 1).compareTo(list.get(i)) < 0,
          list.get(i - 1) + " should precede " + list.get(i));
    }
  }

  private static void assertValidGrowth(RestrictedGrowthString rgs) {
    int max = -1;
    for (int position = 1; position <= rgs.length(); position++) {
      int label = rgs.label(position);
      if (position == 1) {
        assertEquals(0, label, "first label of " + rgs);
      }
      assertTrue(label >= 0 && label <= max + 1, "growth rule broken in " + rgs);
      max = Math.max(max, label);
    }
    assertEquals(max + 1, rgs.blockCount());
  }
}
