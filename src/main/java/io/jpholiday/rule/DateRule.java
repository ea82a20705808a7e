package io.jpholiday.rule;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A named holiday rule: a conjunction of year, month and day predicates.
 *
 * @param name the holiday name
 * @param kind the holiday category
 * @param year the year predicate
 * @param month the month predicate
 * @param day the day predicate
 */
public record DateRule(String name, HolidayKind kind, YearRule year, MonthRule month, DayRule day) {

  public DateRule {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(year, "year");
    Objects.requireNonNull(month, "month");
    Objects.requireNonNull(day, "day");
  }

  /**
   * Checks whether the given date satisfies all three predicates.
   *
   * <p>Predicates are evaluated year, month, then day, so the (possibly recursive) day rule only
   * runs for dates already inside the rule's year and month range.
   *
   * @param date the candidate date
   * @param holidays lookup for genuine holidays on other dates
   * @return true if the date matches this rule
   */
  public boolean matches(LocalDate date, HolidayLookup holidays) {
    if (!year.matches(date)) {
      return false;
    }
    if (!month.matches(date)) {
      return false;
    }
    return day.matches(date, holidays);
  }

  /**
   * Creates a genuine holiday rule.
   *
   * @param name the holiday name
   * @param year the year predicate
   * @param month the month predicate
   * @param day the day predicate
   * @return a new rule
   */
  public static DateRule holiday(String name, YearRule year, MonthRule month, DayRule day) {
    return new DateRule(name, HolidayKind.HOLIDAY, year, month, day);
  }

  /**
   * Creates a substitute holiday rule.
   *
   * @param name the holiday name
   * @param year the year predicate
   * @param month the month predicate
   * @param day the day predicate
   * @return a new rule
   */
  public static DateRule substitute(String name, YearRule year, MonthRule month, DayRule day) {
    return new DateRule(name, HolidayKind.SUBSTITUTE_HOLIDAY, year, month, day);
  }

  /**
   * Creates a national (bridging) holiday rule.
   *
   * @param name the holiday name
   * @param year the year predicate
   * @param month the month predicate
   * @param day the day predicate
   * @return a new rule
   */
  public static DateRule national(String name, YearRule year, MonthRule month, DayRule day) {
    return new DateRule(name, HolidayKind.NATIONAL_HOLIDAY, year, month, day);
  }
}
