package partitions.enumeration;

import java.util.Objects;
import partitions.core.InvalidRequestException;

/**
 * Validated enumeration request. For {@link Mode#ALL} the block count is not used and is stored
 * as zero.
 */
public record PartitionRequest(int n, Mode mode, int k) {

  public PartitionRequest {
    if (mode == null) {
      throw new InvalidRequestException("mode is required");
    }
    mode.validate(n, k);
    if (!mode.usesBlockCount()) {
      k = 0;
    }
  }

  public static PartitionRequest all(int n) {
    return new PartitionRequest(n, Mode.ALL, 0);
  }

  public static PartitionRequest exactly(int n, int k) {
    return new PartitionRequest(n, Mode.EXACT_K, k);
  }

  /**
   * Request for modes that take no block count.
   *
   * @throws InvalidRequestException if {@code mode} needs k
   */
  public static PartitionRequest of(int n, Mode mode) {
    Objects.requireNonNull(mode, "mode");
    if (mode.usesBlockCount()) {
      throw InvalidRequestException.of("Mode %s requires a block count k", mode);
    }
    return new PartitionRequest(n, mode, 0);
  }

  public BlockBounds bounds() {
    return mode.bounds(n, k);
  }

  @Override
  public String toString() {
    return mode.usesBlockCount() ? "n=" + n + ", " + mode + ", k=" + k : "n=" + n + ", " + mode;
  }
}
