package partitions.cli;

/** A subcommand of {@link Main}. Arguments arrive without the command name. */
interface CliCommand {
  String name();

  /** Returns the process exit code. */
  int execute(String[] args);
}
