package io.jpholiday.rule;

/** The category of a holiday rule. */
public enum HolidayKind {
  /** A genuine fixed, floating or computed observance. */
  HOLIDAY("holiday"),
  /** A weekday granted off because a holiday fell on a Sunday. */
  SUBSTITUTE_HOLIDAY("substitute"),
  /** A weekday sandwiched between two holidays. */
  NATIONAL_HOLIDAY("national");

  private final String value;

  HolidayKind(String value) {
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
