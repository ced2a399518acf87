package partitions.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.core.InvalidRequestException;
import partitions.core.StirlingNumbers;
import partitions.enumeration.PartitionEnumerator;
import partitions.recurrence.RecurrenceTreeBuilder;

/**
 * Command-line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code enumerate --n 5 [--mode all|exact --k 2] [--start I] [--limit L] [--reverse]
 *       [--format text|json]}; {@code --start} is zero-based
 *   <li>{@code count --n 6 [--k 3]}
 *   <li>{@code decode --rgs 0,0,1,0,2 [--format json]}
 *   <li>{@code tree --n 4 --k 2 [--order dfs|bfs] [--steps S] [--delay-ms 800] [--format json]}
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 invalid request, 2 malformed command line.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_INVALID_REQUEST = 1;
  static final int EXIT_USAGE = 2;

  private final Map<String, CliCommand> commands = new LinkedHashMap<>();

  Main(PrintStream out) {
    StirlingNumbers numbers = StirlingNumbers.shared();
    PartitionEnumerator enumerator = new PartitionEnumerator(numbers);
    register(new EnumerateCommand(enumerator, out));
    register(new CountCommand(enumerator, numbers, out));
    register(new DecodeCommand(out));
    register(new TreeCommand(new RecurrenceTreeBuilder(), out));
  }

  public static void main(String[] args) {
    System.exit(new Main(System.out).run(args));
  }

  int run(String[] args) {
    if (args == null || args.length == 0) {
      LOG.error("Missing command; expected one of {}", commands.keySet());
      return EXIT_USAGE;
    }
    CliCommand command = commands.get(args[0].toLowerCase(Locale.ROOT));
    if (command == null) {
      LOG.error("Unknown command: {} (expected one of {})", args[0], commands.keySet());
      return EXIT_USAGE;
    }
    try {
      return command.execute(Arrays.copyOfRange(args, 1, args.length));
    } catch (InvalidRequestException ex) {
      LOG.error("Invalid request: {}", ex.getMessage());
      return EXIT_INVALID_REQUEST;
    } catch (IllegalArgumentException ex) {
      LOG.error("{}: {}", command.name(), ex.getMessage());
      return EXIT_USAGE;
    }
  }

  private void register(CliCommand command) {
    commands.put(command.name(), command);
  }
}
