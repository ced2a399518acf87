package partitions.cli;

import partitions.cli.CliParsers.OutputFormat;
import partitions.recurrence.TraversalOrder;

/**
 * Options of the {@code tree} command. {@code steps} of 0 reveals the whole trace; {@code delayMs}
 * paces the reveal like an autoplay loop.
 */
record TreeOptions(
    int n, int k, TraversalOrder order, int steps, long delayMs, OutputFormat format) {

  TreeOptions {
    order = order == null ? TraversalOrder.DFS : order;
    format = format == null ? OutputFormat.TEXT : format;
    if (steps < 0) {
      throw new UsageException("--steps must be non-negative");
    }
    if (delayMs < 0) {
      throw new UsageException("--delay-ms must be non-negative");
    }
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Integer n;
    private Integer k;
    private TraversalOrder order = TraversalOrder.DFS;
    private int steps;
    private long delayMs;
    private OutputFormat format = OutputFormat.TEXT;

    Builder n(int n) {
      this.n = n;
      return this;
    }

    Builder k(int k) {
      this.k = k;
      return this;
    }

    Builder order(TraversalOrder order) {
      this.order = order;
      return this;
    }

    Builder steps(int steps) {
      this.steps = steps;
      return this;
    }

    Builder delayMs(long delayMs) {
      this.delayMs = delayMs;
      return this;
    }

    Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    TreeOptions build() {
      if (n == null || k == null) {
        throw new UsageException("--n and --k are required");
      }
      return new TreeOptions(n, k, order, steps, delayMs, format);
    }
  }
}
