package partitions.cli;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import partitions.enumeration.Mode;
import partitions.recurrence.TraversalOrder;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter LIST_SPLITTER =
      Splitter.on(CharMatcher.anyOf(", ")).trimResults().omitEmptyStrings();

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new UsageException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new UsageException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static BigInteger parseIndex(String raw, String optionName) {
    try {
      return new BigInteger(raw.trim());
    } catch (NumberFormatException ex) {
      throw new UsageException("Invalid index for " + optionName + ": " + raw);
    }
  }

  /** {@code 0,0,1,0,2}, {@code 0 0 1 0 2} or {@code [0, 0, 1]}. */
  static List<Integer> parseLabels(String raw, String optionName) {
    if (raw == null) {
      throw new UsageException("Missing value for " + optionName);
    }
    String body = CharMatcher.anyOf("[]").removeFrom(raw);
    try {
      return LIST_SPLITTER.splitToList(body).stream().map(Integer::valueOf).toList();
    } catch (NumberFormatException ex) {
      throw new UsageException("Invalid label list for " + optionName + ": " + raw);
    }
  }

  static Mode parseMode(String raw) {
    if (raw == null || raw.isBlank()) {
      return Mode.ALL;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "all", "any" -> Mode.ALL;
      case "exact", "exact-k", "exact_k", "k" -> Mode.EXACT_K;
      default -> throw new UsageException("Invalid mode: " + raw);
    };
  }

  static TraversalOrder parseOrder(String raw) {
    if (raw == null || raw.isBlank()) {
      return TraversalOrder.DFS;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "dfs", "depth", "preorder" -> TraversalOrder.DFS;
      case "bfs", "breadth", "level" -> TraversalOrder.BFS;
      default -> throw new UsageException("Invalid order: " + raw);
    };
  }

  static OutputFormat parseFormat(String raw) {
    if (raw == null || raw.isBlank()) {
      return OutputFormat.TEXT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text", "plain" -> OutputFormat.TEXT;
      case "json" -> OutputFormat.JSON;
      default -> throw new UsageException("Invalid format: " + raw);
    };
  }

  enum OutputFormat {
    TEXT,
    JSON
  }
}
