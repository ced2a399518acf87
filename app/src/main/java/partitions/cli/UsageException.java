package partitions.cli;

/** Malformed command line, as opposed to a well-formed but impossible request. */
final class UsageException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  UsageException(String message) {
    super(message);
  }
}
