package partitions.enumeration;

import java.math.BigInteger;
import java.util.Objects;
import partitions.core.InvalidRequestException;
import partitions.model.RestrictedGrowthString;

/**
 * Lexicographic rank and unrank for the strings of one {@link PartitionRequest}.
 *
 * <p>{@code completions(r, b)} counts the ways to fill {@code r} further positions when {@code b}
 * blocks are already open, ending inside the request's block bounds: {@code C(0, b) = [b in
 * bounds]} and {@code C(r, b) = b·C(r-1, b) + C(r-1, b+1)}, the second term only while another
 * block may be opened. Every label below the current one at position {@code i} keeps the same
 * prefix maximum, so the rank is {@code sum a[i]·C(n-1-i, prefixMax[i]+1)}.
 */
public final class RgsRanking {
  private final PartitionRequest request;
  private final BlockBounds bounds;
  private final BigInteger[][] completions;

  public RgsRanking(PartitionRequest request) {
    this.request = Objects.requireNonNull(request, "request");
    this.bounds = request.bounds();
    this.completions = buildTable(request.n(), bounds);
  }

  public PartitionRequest request() {
    return request;
  }

  /** Number of strings in the request; agrees with the Stirling/Bell count. */
  public BigInteger total() {
    if (request.n() == 0) {
      return bounds.admits(0) ? BigInteger.ONE : BigInteger.ZERO;
    }
    return completions(request.n() - 1, 1);
  }

  /**
   * Zero-based position of {@code rgs} in the request's enumeration order.
   *
   * @throws InvalidRequestException if {@code rgs} does not belong to the request
   */
  public BigInteger rank(RestrictedGrowthString rgs) {
    requireMember(rgs);
    int n = rgs.length();
    BigInteger rank = BigInteger.ZERO;
    int max = -1;
    for (int i = 0; i < n; i++) {
      int label = rgs.label(i + 1);
      if (i > 0 && label > 0) {
        rank = rank.add(BigInteger.valueOf(label).multiply(completions(n - 1 - i, max + 1)));
      }
      max = Math.max(max, label);
    }
    return rank;
  }

  /**
   * Labels of the string at {@code index}.
   *
   * @throws InvalidRequestException if {@code index} is outside {@code [0, total())}
   */
  public int[] unrank(BigInteger index) {
    Objects.requireNonNull(index, "index");
    BigInteger total = total();
    if (index.signum() < 0 || index.compareTo(total) >= 0) {
      throw InvalidRequestException.of(
          "Index %s outside 0..%s for %s", index, total.subtract(BigInteger.ONE), request);
    }
    int n = request.n();
    int[] labels = new int[n];
    BigInteger remaining = index;
    int used = 1;
    for (int i = 1; i < n; i++) {
      BigInteger each = completions(n - 1 - i, used);
      BigInteger reuse = each.multiply(BigInteger.valueOf(used));
      if (remaining.compareTo(reuse) < 0) {
        BigInteger[] split = remaining.divideAndRemainder(each);
        labels[i] = split[0].intValueExact();
        remaining = split[1];
      } else {
        remaining = remaining.subtract(reuse);
        labels[i] = used++;
      }
    }
    return labels;
  }

  BigInteger completions(int remaining, int used) {
    if (used > bounds.max()) {
      return BigInteger.ZERO;
    }
    return completions[remaining][used];
  }

  private void requireMember(RestrictedGrowthString rgs) {
    Objects.requireNonNull(rgs, "rgs");
    if (rgs.length() != request.n() || !bounds.admits(rgs.blockCount())) {
      throw InvalidRequestException.of("%s is not a partition for %s", rgs, request);
    }
  }

  private static BigInteger[][] buildTable(int n, BlockBounds bounds) {
    int rows = Math.max(n, 1);
    BigInteger[][] table = new BigInteger[rows][bounds.max() + 1];
    for (int used = 0; used <= bounds.max(); used++) {
      table[0][used] = bounds.admits(used) ? BigInteger.ONE : BigInteger.ZERO;
    }
    for (int r = 1; r < rows; r++) {
      for (int used = 0; used <= bounds.max(); used++) {
        BigInteger value = BigInteger.valueOf(used).multiply(table[r - 1][used]);
        if (used < bounds.max()) {
          value = value.add(table[r - 1][used + 1]);
        }
        table[r][used] = value;
      }
    }
    return table;
  }
}
