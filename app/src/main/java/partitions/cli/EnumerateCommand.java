package partitions.cli;

import com.google.common.base.Stopwatch;
import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.cli.CliParsers.OutputFormat;
import partitions.core.InvalidRequestException;
import partitions.enumeration.EnumerationCursor;
import partitions.enumeration.PartitionEnumerator;
import partitions.enumeration.PartitionRequest;
import partitions.enumeration.PartitionSummary;
import partitions.model.RestrictedGrowthString;

/**
 * Handles the {@code enumerate} command: walks the partitions of {1..n} forwards or backwards
 * from a start index and prints each one with its position.
 */
final class EnumerateCommand implements CliCommand {
  private static final Logger LOG = LoggerFactory.getLogger(EnumerateCommand.class);

  private final PartitionEnumerator enumerator;
  private final PrintStream out;

  EnumerateCommand(PartitionEnumerator enumerator, PrintStream out) {
    this.enumerator = enumerator;
    this.out = out;
  }

  @Override
  public String name() {
    return "enumerate";
  }

  @Override
  public int execute(String[] args) {
    EnumerateOptions options = parseArgs(args);
    PartitionRequest request = options.request();
    int maxSetSize = CliDefaults.maxSetSize();
    if (request.n() > maxSetSize) {
      throw InvalidRequestException.of(
          "n = %d exceeds the printable limit %d (set -D%s to raise it)",
          request.n(), maxSetSize, CliDefaults.MAX_SET_SIZE_PROPERTY);
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    List<PartitionSummary> visited = walk(request, options);
    LOG.info(
        "Visited {} of {} partitions ({}) in {} ms",
        visited.size(),
        enumerator.count(request),
        request,
        stopwatch.elapsed(TimeUnit.MILLISECONDS));

    if (options.format() == OutputFormat.JSON) {
      out.println(new JsonReportBuilder().enumeration(request, enumerator.count(request), visited));
    } else {
      visited.forEach(summary -> out.println(TextFormats.partitionLine(summary)));
    }
    return 0;
  }

  private List<PartitionSummary> walk(PartitionRequest request, EnumerateOptions options) {
    EnumerationCursor cursor = openCursor(request, options);
    List<PartitionSummary> visited = new ArrayList<>();
    visited.add(enumerator.summarize(cursor));
    while (options.limit() == 0 || visited.size() < options.limit()) {
      Optional<RestrictedGrowthString> moved =
          options.reverse() ? enumerator.previous(cursor) : enumerator.next(cursor);
      if (moved.isEmpty()) {
        break;
      }
      visited.add(enumerator.summarize(cursor));
    }
    return visited;
  }

  private EnumerationCursor openCursor(PartitionRequest request, EnumerateOptions options) {
    if (options.hasStart()) {
      return enumerator.seek(request, options.start());
    }
    if (options.reverse()) {
      return enumerator.seek(request, enumerator.count(request).subtract(BigInteger.ONE));
    }
    return enumerator.first(request);
  }

  private EnumerateOptions parseArgs(String[] args) {
    CommandArgs<EnumerateOptions.Builder> table =
        new CommandArgs<EnumerateOptions.Builder>()
            .withValue("--n", (b, raw) -> b.n(CliParsers.parseInt(raw, 0, "--n")))
            .withValue("--mode", (b, raw) -> b.mode(CliParsers.parseMode(raw)))
            .withValue("--k", (b, raw) -> b.k(CliParsers.parseInt(raw, 0, "--k")))
            .withValue("--start", (b, raw) -> b.start(CliParsers.parseIndex(raw, "--start")))
            .withValue("--limit", (b, raw) -> b.limit(CliParsers.parseInt(raw, 0, "--limit")))
            .flag("--reverse", b -> b.reverse(true))
            .withValue("--format", (b, raw) -> b.format(CliParsers.parseFormat(raw)));
    return table.parse(args, EnumerateOptions.builder()).build();
  }
}
