package io.jpholiday;

/**
 * Exception thrown when a calendar date cannot be constructed.
 *
 * <p>Holiday queries themselves never throw: absence of a holiday is an ordinary result.
 */
public final class HolidayException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The rejected input. */
  private final String input;

  private HolidayException(ErrorKind kind, String message, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new date error.
   *
   * @param message the error message
   * @param input the rejected year, month and day
   * @param cause the underlying exception
   * @return a new HolidayException for a date error
   */
  public static HolidayException date(String message, String input, Throwable cause) {
    return new HolidayException(ErrorKind.DATE, message, input, cause);
  }

  /**
   * Creates a new parse error.
   *
   * @param message the error message
   * @param input the rejected string
   * @param cause the underlying exception
   * @return a new HolidayException for a parse error
   */
  public static HolidayException parse(String message, String input, Throwable cause) {
    return new HolidayException(ErrorKind.PARSE, message, input, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the rejected input.
   *
   * @return the input
   */
  public String input() {
    return input;
  }
}
