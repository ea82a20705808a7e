package io.jpholiday.rule;

import java.time.LocalDate;

/** An arbitrary test over a full date, used by {@link ComputedDay}. */
@FunctionalInterface
public interface DatePredicate {
  /**
   * Tests the given date.
   *
   * @param date the candidate date
   * @param holidays lookup for genuine holidays on other dates
   * @return true if the date satisfies the predicate
   */
  boolean test(LocalDate date, HolidayLookup holidays);
}
