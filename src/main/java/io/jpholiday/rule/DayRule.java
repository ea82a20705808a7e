package io.jpholiday.rule;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Sealed interface for the day part of a holiday rule.
 *
 * <p>There are 3 types of day rules:
 *
 * <ul>
 *   <li>{@link FixedDay} - "the 3rd"
 *   <li>{@link NthWeekday} - "the second monday"
 *   <li>{@link ComputedDay} - equinox formulas, substitute and national holidays
 * </ul>
 */
public sealed interface DayRule permits FixedDay, NthWeekday, ComputedDay {

  /**
   * Checks whether the given date satisfies this day rule.
   *
   * @param date the candidate date
   * @param holidays lookup for genuine holidays on other dates
   * @return true if the date matches
   */
  boolean matches(LocalDate date, HolidayLookup holidays);

  /**
   * Creates a rule matching a fixed day of the month.
   *
   * @param day the day of the month
   * @return a new day rule
   */
  static DayRule just(int day) {
    return new FixedDay(day);
  }

  /**
   * Creates a rule matching the nth occurrence of a weekday in the month.
   *
   * @param week which occurrence
   * @param weekday the weekday
   * @return a new day rule
   */
  static DayRule weekday(WeekOfMonth week, DayOfWeek weekday) {
    return new NthWeekday(week, weekday);
  }

  /**
   * Creates a rule backed by an arbitrary predicate.
   *
   * @param predicate the predicate
   * @return a new day rule
   */
  static DayRule computed(DatePredicate predicate) {
    return new ComputedDay(predicate);
  }
}
