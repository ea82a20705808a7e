package io.jpholiday.rule;

import java.time.LocalDate;

/**
 * A view of the resolver handed to computed day rules so they can inspect neighboring dates.
 *
 * <p>Implementations only consult {@link HolidayKind#HOLIDAY} rules. Substitute and national
 * rules are never evaluated through a lookup, which keeps the recursion one level deep.
 */
@FunctionalInterface
public interface HolidayLookup {
  /** A lookup that reports no holidays at all. */
  HolidayLookup NONE = date -> false;

  /**
   * Checks whether a genuine holiday falls on the given date.
   *
   * @param date the date to check
   * @return true if a holiday-kind rule matches the date
   */
  boolean isHoliday(LocalDate date);
}
