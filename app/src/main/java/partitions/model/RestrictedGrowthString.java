package partitions.model;

import partitions.core.InvalidRequestException;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable restricted growth string: {@code a[1] = 0} and every later label is at most one more
 * than the largest label before it. Label {@code j} names block {@code j} in first-appearance
 * order, so the string encodes exactly one set partition of {1..n}.
 *
 * <p>Positions are 1-based in {@link #label(int)} to match element numbering; {@link #toArray()}
 * returns the 0-based backing copy.
 */
public final class RestrictedGrowthString implements Comparable<RestrictedGrowthString> {
  private static final RestrictedGrowthString EMPTY = new RestrictedGrowthString(new int[0], 0);

  private final int[] labels;
  private final int blockCount;

  private RestrictedGrowthString(int[] labels, int blockCount) {
    this.labels = labels;
    this.blockCount = blockCount;
  }

  /** The zero-length string, encoding the single partition of the empty set. */
  public static RestrictedGrowthString empty() {
    return EMPTY;
  }

  /**
   * Validates and copies {@code labels}.
   *
   * @throws InvalidRequestException if the labels break the growth rule
   */
  public static RestrictedGrowthString of(int... labels) {
    if (labels.length == 0) {
      return EMPTY;
    }
    int max = -1;
    for (int i = 0; i < labels.length; i++) {
      int label = labels[i];
      if (label < 0 || label > max + 1) {
        throw InvalidRequestException.of(
            "Not a restricted growth string: position %d has label %d after maximum %d in %s",
            i + 1, label, max, Arrays.toString(labels));
      }
      max = Math.max(max, label);
    }
    return new RestrictedGrowthString(labels.clone(), max + 1);
  }

  public static RestrictedGrowthString of(List<Integer> labels) {
    return of(labels.stream().mapToInt(Integer::intValue).toArray());
  }

  public int length() {
    return labels.length;
  }

  public boolean isEmpty() {
    return labels.length == 0;
  }

  /** Label of element {@code position}, where {@code 1 <= position <= length()}. */
  public int label(int position) {
    if (position < 1 || position > labels.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " outside 1.." + labels.length);
    }
    return labels[position - 1];
  }

  /** {@code max(a) + 1}, or zero for the empty string. */
  public int blockCount() {
    return blockCount;
  }

  public int[] toArray() {
    return labels.clone();
  }

  public List<Integer> toList() {
    return Arrays.stream(labels).boxed().toList();
  }

  @Override
  public int compareTo(RestrictedGrowthString other) {
    return Arrays.compare(labels, other.labels);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof RestrictedGrowthString other && Arrays.equals(labels, other.labels);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(labels);
  }

  @Override
  public String toString() {
    return Arrays.toString(labels);
  }
}
