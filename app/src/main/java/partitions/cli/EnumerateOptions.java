package partitions.cli;

import java.math.BigInteger;
import java.util.Objects;
import partitions.cli.CliParsers.OutputFormat;
import partitions.enumeration.Mode;
import partitions.enumeration.PartitionRequest;

/** Options of the {@code enumerate} command. A limit of 0 prints every remaining partition. */
record EnumerateOptions(
    int n,
    Mode mode,
    Integer k,
    BigInteger start,
    int limit,
    boolean reverse,
    OutputFormat format) {

  EnumerateOptions {
    Objects.requireNonNull(mode, "mode");
    format = format == null ? OutputFormat.TEXT : format;
    if (limit < 0) {
      throw new UsageException("--limit must be non-negative");
    }
  }

  PartitionRequest request() {
    if (mode.usesBlockCount()) {
      if (k == null) {
        throw new UsageException("--k is required with --mode " + mode);
      }
      return new PartitionRequest(n, mode, k);
    }
    return PartitionRequest.of(n, mode);
  }

  boolean hasStart() {
    return start != null;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Integer n;
    private Mode mode = Mode.ALL;
    private Integer k;
    private BigInteger start;
    private int limit;
    private boolean reverse;
    private OutputFormat format = OutputFormat.TEXT;

    Builder n(int n) {
      this.n = n;
      return this;
    }

    Builder mode(Mode mode) {
      this.mode = mode;
      return this;
    }

    Builder k(int k) {
      this.k = k;
      return this;
    }

    Builder start(BigInteger start) {
      this.start = start;
      return this;
    }

    Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    Builder reverse(boolean reverse) {
      this.reverse = reverse;
      return this;
    }

    Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    EnumerateOptions build() {
      if (n == null) {
        throw new UsageException("--n is required");
      }
      // k alone implies the exact-k mode
      Mode effectiveMode = k != null && mode == Mode.ALL ? Mode.EXACT_K : mode;
      return new EnumerateOptions(n, effectiveMode, k, start, limit, reverse, format);
    }
  }
}
