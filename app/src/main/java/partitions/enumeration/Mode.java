package partitions.enumeration;

import partitions.core.InvalidRequestException;

/** Which partitions of {1..n} an enumeration visits. */
public enum Mode {
  /** Every partition, from the single block {@code [0,...,0]} to the singletons. */
  ALL {
    @Override
    void validate(int n, int k) {
      if (n < 0) {
        throw InvalidRequestException.of("n must be non-negative, got %d", n);
      }
    }

    @Override
    BlockBounds bounds(int n, int k) {
      return n == 0 ? BlockBounds.exactly(0) : new BlockBounds(1, n);
    }
  },

  /** Partitions with exactly k blocks. */
  EXACT_K {
    @Override
    void validate(int n, int k) {
      if (n < 0) {
        throw InvalidRequestException.of("n must be non-negative, got %d", n);
      }
      if (k < 0 || k > n) {
        throw InvalidRequestException.of("k must be in 0..%d for n = %d, got %d", n, n, k);
      }
      if (k == 0 && n > 0) {
        throw InvalidRequestException.of(
            "A non-empty set has no partition into 0 blocks (n = %d)", n);
      }
    }

    @Override
    BlockBounds bounds(int n, int k) {
      return BlockBounds.exactly(k);
    }

    @Override
    public boolean usesBlockCount() {
      return true;
    }
  };

  abstract void validate(int n, int k);

  abstract BlockBounds bounds(int n, int k);

  /** Whether requests in this mode carry a block count. */
  public boolean usesBlockCount() {
    return false;
  }
}
