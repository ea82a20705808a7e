package io.jpholiday.rule;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * The nth occurrence of a weekday within the candidate's month (e.g., the third monday).
 *
 * @param week which occurrence
 * @param weekday the weekday
 */
public record NthWeekday(WeekOfMonth week, DayOfWeek weekday) implements DayRule {

  /** Days are counted Sunday=0 through Saturday=6 within a week. */
  private static final int SATURDAY = 6;

  @Override
  public boolean matches(LocalDate date, HolidayLookup holidays) {
    LocalDate target = occurrenceIn(date);
    // A fifth occurrence may spill into the next month.
    return target.getMonthValue() == date.getMonthValue()
        && target.getDayOfMonth() == date.getDayOfMonth();
  }

  /**
   * Computes the date of this occurrence in the month of the given date.
   *
   * <p>The result lies in a later month when the month has fewer occurrences than requested.
   *
   * @param date any date in the month
   * @return the computed occurrence
   */
  public LocalDate occurrenceIn(LocalDate date) {
    LocalDate first = date.withDayOfMonth(1);
    int origin = sundayBased(first.getDayOfWeek());
    int wanted = sundayBased(weekday);
    int offset = wanted >= origin ? wanted - origin : SATURDAY - origin + wanted + 1;
    return first.plusDays(7L * (week.number() - 1) + offset);
  }

  private static int sundayBased(DayOfWeek dow) {
    return dow.getValue() % 7;
  }
}
