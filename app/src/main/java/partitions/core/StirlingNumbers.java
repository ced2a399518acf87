package partitions.core;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Memoized Stirling numbers of the second kind and Bell numbers.
 *
 * <p>Values follow S(0,0) = 1, S(n,0) = 0 for n &gt; 0, S(n,n) = 1 and S(n,k) = k·S(n-1,k) +
 * S(n-1,k-1). Pairs outside {@code 0 <= k <= n} have no partitions and evaluate to zero.
 *
 * <p>Values are computed bottom-up, so the call stack stays flat for any n. The cache is
 * append-only: every key is written once and never evicted, so concurrent writers only ever race
 * to store the same value.
 */
public final class StirlingNumbers {
  private static final StirlingNumbers SHARED = new StirlingNumbers();

  private final Map<Long, BigInteger> cache = new ConcurrentHashMap<>();
  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();

  public StirlingNumbers() {}

  /** Process-wide instance used when callers do not bring their own cache. */
  public static StirlingNumbers shared() {
    return SHARED;
  }

  public BigInteger stirling(int n, int k) {
    if (n < 0 || k < 0 || k > n) {
      return BigInteger.ZERO;
    }
    if (k == n) {
      return BigInteger.ONE;
    }
    if (k == 0) {
      return BigInteger.ZERO;
    }
    BigInteger cached = cache.get(key(n, k));
    if (cached != null) {
      hits.increment();
      return cached;
    }
    misses.increment();
    return fill(n, k, k)[k];
  }

  /** S(n,0), S(n,1), ..., S(n,n). */
  public List<BigInteger> row(int n) {
    requireSize(n);
    return List.of(fill(n, 0, n));
  }

  /** Number of partitions of an n-element set into any number of blocks. */
  public BigInteger bell(int n) {
    return between(n, 0, n);
  }

  /**
   * Number of partitions of an n-element set into at least {@code minBlocks} and at most {@code
   * maxBlocks} blocks. Block counts above n contribute nothing.
   */
  public BigInteger between(int n, int minBlocks, int maxBlocks) {
    requireSize(n);
    if (minBlocks < 0 || maxBlocks < minBlocks) {
      throw InvalidRequestException.of(
          "Invalid block range [%d, %d] for n = %d", minBlocks, maxBlocks, n);
    }
    int high = Math.min(maxBlocks, n);
    if (minBlocks > high) {
      return BigInteger.ZERO;
    }
    BigInteger[] row = fill(n, minBlocks, high);
    BigInteger total = BigInteger.ZERO;
    for (int k = minBlocks; k <= high; k++) {
      total = total.add(row[k]);
    }
    return total;
  }

  public int cachedEntries() {
    return cache.size();
  }

  public CacheStats stats() {
    return CacheStats.of(hits.sum(), misses.sum());
  }

  /**
   * Evaluates the recurrence row by row up to row n and returns that row. Only the band of
   * columns that can reach S(n, low..high) is computed; entries outside it are left null.
   */
  private BigInteger[] fill(int n, int low, int high) {
    BigInteger[] row = new BigInteger[high + 1];
    for (int i = 0; i <= n; i++) {
      int from = Math.max(0, low - (n - i));
      int to = Math.min(i, high);
      // descending so row[j - 1] still holds S(i - 1, j - 1)
      for (int j = to; j >= from; j--) {
        if (j == i) {
          row[j] = BigInteger.ONE;
        } else if (j == 0) {
          row[j] = BigInteger.ZERO;
        } else {
          row[j] = BigInteger.valueOf(j).multiply(row[j]).add(row[j - 1]);
          cache.putIfAbsent(key(i, j), row[j]);
        }
      }
    }
    return row;
  }

  private static void requireSize(int n) {
    if (n < 0) {
      throw InvalidRequestException.of("n must be non-negative, got %d", n);
    }
  }

  private static Long key(int n, int k) {
    return ((long) n << 32) | (k & 0xffffffffL);
  }
}
