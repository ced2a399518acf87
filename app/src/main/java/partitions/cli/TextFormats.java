package partitions.cli;

import java.math.BigInteger;
import java.util.List;
import partitions.enumeration.PartitionSummary;
import partitions.recurrence.RecurrenceTree;
import partitions.recurrence.RevealEvent;

/** Plain-text renderings shared by the commands. */
final class TextFormats {

  private TextFormats() {}

  /** {@code 3/15  [0, 0, 1, 0]  { {1, 2, 4}, {3} }}. */
  static String partitionLine(PartitionSummary summary) {
    return String.format(
        "%s/%s  %s  %s  sizes=%s",
        summary.ordinal(),
        summary.total(),
        summary.rgs(),
        summary.partition().format(),
        summary.blockSizes());
  }

  /** {@code [2] S(2,1) = 1  via S(2,1)}, indented by depth. */
  static String eventLine(RevealEvent event) {
    String indent = "  ".repeat(event.node().depth());
    String via = event.incomingEdge().map(edge -> "  via " + edge.label()).orElse("");
    return String.format(
        "[%d] %s%s  (%s)%s", event.index(), indent, event.node().label(), event.node().kind(), via);
  }

  static String treeSummary(RecurrenceTree tree) {
    return String.format(
        "%s: %d nodes (%d recursive, %d base), height %d",
        tree.root().label(), tree.size(), tree.recursiveCount(), tree.baseCount(), tree.height());
  }

  static String countTable(int n, BigInteger bell, List<BigInteger> row) {
    StringBuilder sb = new StringBuilder();
    sb.append("Bell(").append(n).append(") = ").append(bell).append(System.lineSeparator());
    for (int k = 0; k < row.size(); k++) {
      sb.append("  S(").append(n).append(',').append(k).append(") = ").append(row.get(k));
      sb.append(System.lineSeparator());
    }
    return sb.toString().stripTrailing();
  }
}
