package io.jpholiday.rule;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A day rule backed by an arbitrary predicate over the full date.
 *
 * @param predicate the predicate
 */
public record ComputedDay(DatePredicate predicate) implements DayRule {

  public ComputedDay {
    Objects.requireNonNull(predicate, "predicate");
  }

  @Override
  public boolean matches(LocalDate date, HolidayLookup holidays) {
    return predicate.test(date, holidays);
  }
}
