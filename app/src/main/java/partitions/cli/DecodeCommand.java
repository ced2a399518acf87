package partitions.cli;

import java.io.PrintStream;
import java.math.BigInteger;
import java.util.List;
import partitions.cli.CliParsers.OutputFormat;
import partitions.enumeration.PartitionEnumerator;
import partitions.enumeration.PartitionRequest;
import partitions.enumeration.RgsRanking;
import partitions.model.RestrictedGrowthString;
import partitions.model.SetPartition;

/** Handles the {@code decode} command: blocks and ranks of one restricted growth string. */
final class DecodeCommand implements CliCommand {
  private final PrintStream out;

  DecodeCommand(PrintStream out) {
    this.out = out;
  }

  @Override
  public String name() {
    return "decode";
  }

  @Override
  public int execute(String[] args) {
    DecodeArgs parsed =
        new CommandArgs<DecodeArgs>()
            .withValue("--rgs", (b, raw) -> b.labels = CliParsers.parseLabels(raw, "--rgs"))
            .withValue("--format", (b, raw) -> b.format = CliParsers.parseFormat(raw))
            .parse(args, new DecodeArgs());
    if (parsed.labels == null) {
      throw new UsageException("--rgs is required");
    }

    RestrictedGrowthString rgs = RestrictedGrowthString.of(parsed.labels);
    SetPartition partition = PartitionEnumerator.blocksOf(rgs);
    PartitionRequest all = PartitionRequest.all(rgs.length());
    PartitionRequest exact = PartitionRequest.exactly(rgs.length(), rgs.blockCount());
    BigInteger rankAll = new RgsRanking(all).rank(rgs);
    BigInteger rankExact = new RgsRanking(exact).rank(rgs);

    if (parsed.format == OutputFormat.JSON) {
      out.println(new JsonReportBuilder().decoded(rgs, partition, rankAll, rankExact));
    } else {
      out.printf("%s -> %s (%d blocks)%n", rgs, partition.format(), partition.size());
      out.printf("  position among all partitions: %s%n", rankAll.add(BigInteger.ONE));
      out.printf(
          "  position among %d-block partitions: %s%n",
          rgs.blockCount(), rankExact.add(BigInteger.ONE));
    }
    return 0;
  }

  private static final class DecodeArgs {
    private List<Integer> labels;
    private OutputFormat format = OutputFormat.TEXT;
  }
}
