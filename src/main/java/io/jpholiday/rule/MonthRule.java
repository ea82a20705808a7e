package io.jpholiday.rule;

import java.time.LocalDate;
import java.time.Month;

/**
 * A closed interval of months (January=1, December=12).
 *
 * @param start the first matching month (inclusive)
 * @param end the last matching month (inclusive)
 */
public record MonthRule(int start, int end) {

  public MonthRule {
    if (start > end) {
      throw new IllegalArgumentException("month range " + start + ".." + end + " is inverted");
    }
  }

  /**
   * Checks whether the month of the given date falls within this interval.
   *
   * @param date the date to check
   * @return true if the date's month is within [start, end]
   */
  public boolean matches(LocalDate date) {
    int month = date.getMonthValue();
    return month >= start && month <= end;
  }

  /**
   * Creates a rule matching exactly one month.
   *
   * @param month the month
   * @return a new month rule
   */
  public static MonthRule just(Month month) {
    return new MonthRule(month.getValue(), month.getValue());
  }

  /**
   * Creates a rule matching every month up to and including the given one.
   *
   * @param month the last matching month
   * @return a new month rule
   */
  public static MonthRule before(Month month) {
    return new MonthRule(Month.JANUARY.getValue(), month.getValue());
  }

  /**
   * Creates a rule matching the given month and every month after it.
   *
   * @param month the first matching month
   * @return a new month rule
   */
  public static MonthRule after(Month month) {
    return new MonthRule(month.getValue(), Month.DECEMBER.getValue());
  }

  /**
   * Creates a rule matching an explicit range of months.
   *
   * @param start the first matching month
   * @param end the last matching month
   * @return a new month rule
   */
  public static MonthRule range(Month start, Month end) {
    return new MonthRule(start.getValue(), end.getValue());
  }

  /**
   * Creates a rule matching every month.
   *
   * @return a new month rule
   */
  public static MonthRule any() {
    return new MonthRule(Month.JANUARY.getValue(), Month.DECEMBER.getValue());
  }
}
