package partitions.enumeration;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.core.InvalidRequestException;
import partitions.core.StirlingNumbers;
import partitions.model.RestrictedGrowthString;
import partitions.model.SetPartition;

/**
 * Generates, navigates and counts set partitions of {1..n} encoded as restricted growth strings,
 * in lexicographic order.
 *
 * <p>Successor and predecessor follow Stamatelatos and Efraimidis, "Lexicographic Enumeration of
 * Set Partitions" (arXiv:2105.07472): algorithm V for {@link Mode#ALL} and algorithm X for {@link
 * Mode#EXACT_K}, both driven by the same restriction vector (see {@link RgsStepper}). The paper's
 * algorithms Y and Z are other traversal orders and are not implemented; a new order or
 * block-count constraint plugs in as a {@link Mode} constant.
 *
 * <p>Invalid requests fail with {@link InvalidRequestException} when the cursor is created.
 * Running off either end of an enumeration is not an error: {@link #next} and {@link #previous}
 * return {@link Optional#empty()} and leave the cursor where it was.
 */
public final class PartitionEnumerator {
  private static final Logger LOG = LoggerFactory.getLogger(PartitionEnumerator.class);

  private final StirlingNumbers numbers;

  public PartitionEnumerator() {
    this(StirlingNumbers.shared());
  }

  public PartitionEnumerator(StirlingNumbers numbers) {
    this.numbers = Objects.requireNonNull(numbers, "numbers");
  }

  /** Cursor on the lexicographically smallest partition of a mode that takes no k. */
  public EnumerationCursor first(int n, Mode mode) {
    return first(PartitionRequest.of(n, mode));
  }

  public EnumerationCursor first(int n, Mode mode, int k) {
    return first(new PartitionRequest(n, mode, k));
  }

  public EnumerationCursor first(PartitionRequest request) {
    Objects.requireNonNull(request, "request");
    EnumerationCursor cursor = EnumerationCursor.atFirst(request);
    LOG.debug("Opened cursor for {} at {}", request, cursor.current());
    return cursor;
  }

  /** Advances {@code cursor} in place; empty once it stands on the last partition. */
  public Optional<RestrictedGrowthString> next(EnumerationCursor cursor) {
    Objects.requireNonNull(cursor, "cursor");
    return cursor.advance() ? Optional.of(cursor.current()) : Optional.empty();
  }

  /** Moves {@code cursor} back in place; empty when it stands on the first partition. */
  public Optional<RestrictedGrowthString> previous(EnumerationCursor cursor) {
    Objects.requireNonNull(cursor, "cursor");
    return cursor.retreat() ? Optional.of(cursor.current()) : Optional.empty();
  }

  /**
   * Cursor on the partition at zero-based {@code index}, without walking from the first one.
   *
   * @throws InvalidRequestException if {@code index} is out of range
   */
  public EnumerationCursor seek(PartitionRequest request, BigInteger index) {
    Objects.requireNonNull(request, "request");
    int[] labels = new RgsRanking(request).unrank(index);
    EnumerationCursor cursor = new EnumerationCursor(request, labels, index);
    LOG.debug("Positioned cursor for {} at index {}: {}", request, index, cursor.current());
    return cursor;
  }

  public EnumerationCursor seek(PartitionRequest request, long index) {
    return seek(request, BigInteger.valueOf(index));
  }

  /**
   * Cursor standing on {@code rgs}.
   *
   * @throws InvalidRequestException if {@code rgs} is not one of the request's partitions
   */
  public EnumerationCursor positionAt(PartitionRequest request, RestrictedGrowthString rgs) {
    Objects.requireNonNull(request, "request");
    BigInteger index = new RgsRanking(request).rank(rgs);
    return new EnumerationCursor(request, rgs.toArray(), index);
  }

  public BigInteger count(int n, Mode mode) {
    return count(PartitionRequest.of(n, mode));
  }

  public BigInteger count(int n, Mode mode, int k) {
    return count(new PartitionRequest(n, mode, k));
  }

  /**
   * Sum of S(n,b) over the request's block bounds: Bell(n) for {@link Mode#ALL}, S(n,k) for
   * {@link Mode#EXACT_K}.
   */
  public BigInteger count(PartitionRequest request) {
    Objects.requireNonNull(request, "request");
    BlockBounds bounds = request.bounds();
    return numbers.between(request.n(), bounds.min(), bounds.max());
  }

  public PartitionSummary summarize(EnumerationCursor cursor) {
    Objects.requireNonNull(cursor, "cursor");
    RestrictedGrowthString rgs = cursor.current();
    return new PartitionSummary(
        cursor.request(), cursor.position(), count(cursor.request()), rgs, blocksOf(rgs));
  }

  /** All partitions of the request as strings, lazily, in lexicographic order. */
  public Stream<RestrictedGrowthString> stream(PartitionRequest request) {
    EnumerationCursor cursor = first(request);
    return Stream.iterate(
        cursor.current(), Objects::nonNull, previous -> next(cursor).orElse(null));
  }

  public Stream<SetPartition> partitions(PartitionRequest request) {
    return stream(request).map(PartitionEnumerator::blocksOf);
  }

  /** Blocks of {@code rgs} in label order; block {@code j} holds the positions labelled j. */
  public static SetPartition blocksOf(RestrictedGrowthString rgs) {
    return SetPartition.fromRgs(rgs);
  }
}
