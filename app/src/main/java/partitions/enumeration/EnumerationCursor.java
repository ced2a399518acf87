package partitions.enumeration;

import java.math.BigInteger;
import java.util.Objects;
import partitions.model.RestrictedGrowthString;

/**
 * Mutable position inside one enumeration: the current labels, their restriction vector, the
 * zero-based position and whether a {@code next} has run off the end.
 *
 * <p>Created by {@link PartitionEnumerator}, which also moves it. A cursor is owned by one caller
 * and is not thread-safe.
 */
public final class EnumerationCursor {
  private final PartitionRequest request;
  private final BlockBounds bounds;
  private final int[] labels;
  private final int[] prefixMax;
  private BigInteger position;
  private boolean exhausted;

  EnumerationCursor(PartitionRequest request, int[] labels, BigInteger position) {
    this.request = Objects.requireNonNull(request, "request");
    this.bounds = request.bounds();
    this.labels = labels;
    this.prefixMax = new int[labels.length];
    this.position = position;
    RgsStepper.refresh(labels, prefixMax);
  }

  static EnumerationCursor atFirst(PartitionRequest request) {
    int[] labels = new int[request.n()];
    EnumerationCursor cursor = new EnumerationCursor(request, labels, BigInteger.ZERO);
    RgsStepper.first(cursor.labels, cursor.prefixMax, cursor.bounds);
    return cursor;
  }

  public PartitionRequest request() {
    return request;
  }

  public RestrictedGrowthString current() {
    return RestrictedGrowthString.of(labels);
  }

  public int blockCount() {
    return RgsStepper.blockCount(labels, prefixMax);
  }

  /** Zero-based index of {@link #current()} in lexicographic order. */
  public BigInteger position() {
    return position;
  }

  /** True after {@code next} has reported that no later partition exists. */
  public boolean isExhausted() {
    return exhausted;
  }

  boolean advance() {
    if (RgsStepper.advance(labels, prefixMax, bounds)) {
      position = position.add(BigInteger.ONE);
      return true;
    }
    exhausted = true;
    return false;
  }

  boolean retreat() {
    if (RgsStepper.retreat(labels, prefixMax, bounds)) {
      position = position.subtract(BigInteger.ONE);
      exhausted = false;
      return true;
    }
    return false;
  }

  @Override
  public String toString() {
    return "EnumerationCursor{" + request + ", at " + position + ": " + current() + "}";
  }
}
