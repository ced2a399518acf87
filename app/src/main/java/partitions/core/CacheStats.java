package partitions.core;

/** Immutable hit/miss counters for a memoization cache. */
public final class CacheStats {
  private final long hits;
  private final long misses;

  private CacheStats(long hits, long misses) {
    this.hits = hits;
    this.misses = misses;
  }

  public static CacheStats of(long hits, long misses) {
    return new CacheStats(hits, misses);
  }

  public long hits() {
    return hits;
  }

  public long misses() {
    return misses;
  }

  public long lookups() {
    return hits + misses;
  }

  public double hitRate() {
    long total = lookups();
    return total == 0 ? 0.0 : hits / (double) total;
  }

  /** Counters accumulated since {@code earlier} was taken. */
  public CacheStats since(CacheStats earlier) {
    return CacheStats.of(hits - earlier.hits, misses - earlier.misses);
  }

  @Override
  public String toString() {
    return String.format("hits=%d misses=%d rate=%.2f", hits, misses, hitRate());
  }
}
