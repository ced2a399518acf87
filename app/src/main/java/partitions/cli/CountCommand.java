package partitions.cli;

import java.io.PrintStream;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.core.StirlingNumbers;
import partitions.enumeration.PartitionEnumerator;
import partitions.enumeration.PartitionRequest;

/** Handles the {@code count} command: Bell(n) with its Stirling row, or a single S(n,k). */
final class CountCommand implements CliCommand {
  private static final Logger LOG = LoggerFactory.getLogger(CountCommand.class);

  private final PartitionEnumerator enumerator;
  private final StirlingNumbers numbers;
  private final PrintStream out;

  CountCommand(PartitionEnumerator enumerator, StirlingNumbers numbers, PrintStream out) {
    this.enumerator = enumerator;
    this.numbers = numbers;
    this.out = out;
  }

  @Override
  public String name() {
    return "count";
  }

  @Override
  public int execute(String[] args) {
    EnumerateOptions options =
        new CommandArgs<EnumerateOptions.Builder>()
            .withValue("--n", (b, raw) -> b.n(CliParsers.parseInt(raw, 0, "--n")))
            .withValue("--mode", (b, raw) -> b.mode(CliParsers.parseMode(raw)))
            .withValue("--k", (b, raw) -> b.k(CliParsers.parseInt(raw, 0, "--k")))
            .parse(args, EnumerateOptions.builder())
            .build();
    PartitionRequest request = options.request();
    BigInteger total = enumerator.count(request);
    if (request.mode().usesBlockCount()) {
      out.printf("S(%d,%d) = %s%n", request.n(), request.k(), total);
    } else {
      out.println(TextFormats.countTable(request.n(), total, numbers.row(request.n())));
    }
    LOG.debug("Stirling cache: {} entries, {}", numbers.cachedEntries(), numbers.stats());
    return 0;
  }
}
