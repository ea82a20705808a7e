package io.jpholiday.rule;

/** Which occurrence of a weekday within a month (first, second, etc.). */
public enum WeekOfMonth {
  FIRST(1, "first"),
  SECOND(2, "second"),
  THIRD(3, "third"),
  FOURTH(4, "fourth"),
  FIFTH(5, "fifth");

  private final int number;
  private final String displayName;

  WeekOfMonth(int number, String displayName) {
    this.number = number;
    this.displayName = displayName;
  }

  /**
   * Returns the occurrence as a number (1-5).
   *
   * @return the occurrence number
   */
  public int number() {
    return number;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
