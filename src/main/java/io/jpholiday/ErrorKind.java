package io.jpholiday;

/** The type of error raised while constructing a date. */
public enum ErrorKind {
  /** Date error - year, month or day out of range. */
  DATE("date"),
  /** Parse error - input is not an ISO-8601 calendar date. */
  PARSE("parse");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
