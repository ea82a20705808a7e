package io.jpholiday.rule;

import java.time.LocalDate;

/**
 * A fixed day of the month (e.g., the 11th).
 *
 * @param day the day of the month (1-31)
 */
public record FixedDay(int day) implements DayRule {

  public FixedDay {
    if (day < 1 || day > 31) {
      throw new IllegalArgumentException("day of month out of range: " + day);
    }
  }

  @Override
  public boolean matches(LocalDate date, HolidayLookup holidays) {
    return date.getDayOfMonth() == day;
  }
}
