package partitions.enumeration;

/**
 * In-place lexicographic stepping over restricted growth strings whose block count lies in a
 * {@link BlockBounds} range.
 *
 * <p>{@code prefixMax[i]} is the largest label among positions {@code 0..i-1} ({@code -1} at
 * position 0). It is the restriction vector: position {@code i} may take any label up to {@code
 * prefixMax[i] + 1}, and {@code prefixMax[i] + 1 + (n - 1 - i)} is the most blocks any completion
 * from {@code i} can still reach. Steps only rewrite the suffix they change, so each step is O(n).
 *
 * <p>With bounds {@code [1, n]} this walks every partition (the paper's algorithm V); with {@code
 * [k, k]} it walks exactly-k partitions (algorithm X) without generating and discarding strings
 * of the wrong block count.
 */
final class RgsStepper {

  private RgsStepper() {}

  /** Smallest string: zeros, then labels 1..min-1 opened in the last positions. */
  static void first(int[] labels, int[] prefixMax, BlockBounds bounds) {
    int lastZero = labels.length - Math.max(bounds.min(), 1);
    for (int i = 0; i < labels.length; i++) {
      labels[i] = Math.max(0, i - lastZero);
    }
    refresh(labels, prefixMax);
  }

  /** Replaces {@code labels} with its successor; returns false (unchanged) at the last string. */
  static boolean advance(int[] labels, int[] prefixMax, BlockBounds bounds) {
    int n = labels.length;
    for (int i = n - 1; i >= 1; i--) {
      int candidate = labels[i] + 1;
      if (candidate > prefixMax[i] + 1 || candidate >= bounds.max()) {
        continue;
      }
      int used = Math.max(prefixMax[i], candidate) + 1;
      if (used + (n - 1 - i) < bounds.min()) {
        continue;
      }
      labels[i] = candidate;
      fillSmallest(labels, prefixMax, i + 1, used, bounds);
      return true;
    }
    return false;
  }

  /** Replaces {@code labels} with its predecessor; false (unchanged) at the first string. */
  static boolean retreat(int[] labels, int[] prefixMax, BlockBounds bounds) {
    int n = labels.length;
    for (int i = n - 1; i >= 1; i--) {
      if (labels[i] == 0) {
        continue;
      }
      // the lowered label never exceeds prefixMax[i], so only earlier blocks stay open
      int used = prefixMax[i] + 1;
      if (used + (n - 1 - i) < bounds.min()) {
        continue;
      }
      labels[i]--;
      fillLargest(labels, prefixMax, i + 1, used, bounds);
      return true;
    }
    return false;
  }

  /** Recomputes the whole restriction vector. */
  static void refresh(int[] labels, int[] prefixMax) {
    int max = -1;
    for (int i = 0; i < labels.length; i++) {
      prefixMax[i] = max;
      max = Math.max(max, labels[i]);
    }
  }

  static int blockCount(int[] labels, int[] prefixMax) {
    int n = labels.length;
    return n == 0 ? 0 : Math.max(prefixMax[n - 1], labels[n - 1]) + 1;
  }

  private static void fillSmallest(
      int[] labels, int[] prefixMax, int from, int used, BlockBounds bounds) {
    int n = labels.length;
    for (int j = from; j < n; j++) {
      prefixMax[j] = used - 1;
      if (bounds.min() - used >= n - j) {
        labels[j] = used++;
      } else {
        labels[j] = 0;
      }
    }
  }

  private static void fillLargest(
      int[] labels, int[] prefixMax, int from, int used, BlockBounds bounds) {
    for (int j = from; j < labels.length; j++) {
      prefixMax[j] = used - 1;
      if (used < bounds.max()) {
        labels[j] = used++;
      } else {
        labels[j] = bounds.max() - 1;
      }
    }
  }
}
