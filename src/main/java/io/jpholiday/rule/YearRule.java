package io.jpholiday.rule;

import java.time.LocalDate;

/**
 * A closed interval of years.
 *
 * <p>Both bounds are inclusive, so {@code before(1988)} matches 1988 and {@code after(1949)}
 * matches 1949.
 *
 * @param start the first matching year (inclusive)
 * @param end the last matching year (inclusive)
 */
public record YearRule(int start, int end) {

  public YearRule {
    if (start > end) {
      throw new IllegalArgumentException("year range " + start + ".." + end + " is inverted");
    }
  }

  /**
   * Checks whether the year of the given date falls within this interval.
   *
   * @param date the date to check
   * @return true if the date's year is within [start, end]
   */
  public boolean matches(LocalDate date) {
    int year = date.getYear();
    return year >= start && year <= end;
  }

  /**
   * Creates a rule matching exactly one year.
   *
   * @param year the year
   * @return a new year rule
   */
  public static YearRule just(int year) {
    return new YearRule(year, year);
  }

  /**
   * Creates a rule matching every year up to and including the given one.
   *
   * @param year the last matching year
   * @return a new year rule
   */
  public static YearRule before(int year) {
    return new YearRule(Integer.MIN_VALUE, year);
  }

  /**
   * Creates a rule matching the given year and every year after it.
   *
   * @param year the first matching year
   * @return a new year rule
   */
  public static YearRule after(int year) {
    return new YearRule(year, Integer.MAX_VALUE);
  }

  /**
   * Creates a rule matching an explicit range of years.
   *
   * @param start the first matching year
   * @param end the last matching year
   * @return a new year rule
   */
  public static YearRule range(int start, int end) {
    return new YearRule(start, end);
  }

  /**
   * Creates a rule matching every year.
   *
   * @return a new year rule
   */
  public static YearRule any() {
    return new YearRule(Integer.MIN_VALUE, Integer.MAX_VALUE);
  }
}
