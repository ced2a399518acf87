package partitions.cli;

import com.google.common.base.Stopwatch;
import java.io.PrintStream;
import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.cli.CliParsers.OutputFormat;
import partitions.core.InvalidRequestException;
import partitions.recurrence.ConstructionTrace;
import partitions.recurrence.RecurrenceTree;
import partitions.recurrence.RecurrenceTreeBuilder;
import partitions.recurrence.RevealEvent;
import partitions.recurrence.TraceStepper;

/**
 * Handles the {@code tree} command: builds the recursion tree of S(n,k), resolves it and plays the
 * construction trace one node at a time.
 */
final class TreeCommand implements CliCommand {
  private static final Logger LOG = LoggerFactory.getLogger(TreeCommand.class);

  private final RecurrenceTreeBuilder builder;
  private final PrintStream out;

  TreeCommand(RecurrenceTreeBuilder builder, PrintStream out) {
    this.builder = builder;
    this.out = out;
  }

  @Override
  public String name() {
    return "tree";
  }

  @Override
  public int execute(String[] args) {
    TreeOptions options = parseArgs(args);
    int maxTreeSize = CliDefaults.maxTreeSize();
    if (options.n() > maxTreeSize) {
      throw InvalidRequestException.of(
          "n = %d exceeds the printable tree limit %d (set -D%s to raise it)",
          options.n(), maxTreeSize, CliDefaults.MAX_TREE_SIZE_PROPERTY);
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    RecurrenceTree tree = builder.buildTree(options.n(), options.k());
    BigInteger value = builder.resolveValues(tree);
    LOG.info(
        "S({},{}) = {}: {} nodes built and resolved in {} ms",
        options.n(),
        options.k(),
        value,
        tree.size(),
        stopwatch.elapsed(TimeUnit.MILLISECONDS));

    ConstructionTrace trace = builder.trace(tree, options.order());
    TraceStepper stepper = new TraceStepper(trace);
    int target = options.steps() == 0 ? trace.size() : Math.min(options.steps(), trace.size());
    boolean json = options.format() == OutputFormat.JSON;

    while (stepper.revealedCount() < target) {
      Optional<RevealEvent> event = stepper.step();
      if (event.isEmpty()) {
        break;
      }
      if (!json) {
        out.println(TextFormats.eventLine(event.get()));
      }
      if (!pause(options.delayMs(), stepper)) {
        LOG.warn("Playback interrupted after {} of {} steps", stepper.revealedCount(), target);
        break;
      }
    }

    if (json) {
      out.println(new JsonReportBuilder().tree(tree, stepper));
    } else {
      out.println(TextFormats.treeSummary(tree));
    }
    return 0;
  }

  private boolean pause(long delayMs, TraceStepper stepper) {
    if (delayMs == 0 || stepper.remaining() == 0) {
      return true;
    }
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private TreeOptions parseArgs(String[] args) {
    return new CommandArgs<TreeOptions.Builder>()
        .withValue("--n", (b, raw) -> b.n(CliParsers.parseInt(raw, 0, "--n")))
        .withValue("--k", (b, raw) -> b.k(CliParsers.parseInt(raw, 0, "--k")))
        .withValue("--order", (b, raw) -> b.order(CliParsers.parseOrder(raw)))
        .withValue("--steps", (b, raw) -> b.steps(CliParsers.parseInt(raw, 0, "--steps")))
        .withValue(
            "--delay-ms", (b, raw) -> b.delayMs(CliParsers.parseLong(raw, 0L, "--delay-ms")))
        .withValue("--format", (b, raw) -> b.format(CliParsers.parseFormat(raw)))
        .parse(args, TreeOptions.builder())
        .build();
  }
}
