package partitions.core;

/**
 * Raised when a request names an impossible combination of set size, block count or mode.
 *
 * <p>This is the only failure the enumeration and recurrence components report. It is thrown at
 * request time ({@code first}, {@code count}, {@code buildTree}); stepping through an existing
 * cursor or trace never throws it.
 */
public final class InvalidRequestException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidRequestException(String message) {
    super(message);
  }

  public static InvalidRequestException of(String format, Object... args) {
    return new InvalidRequestException(String.format(format, args));
  }
}
