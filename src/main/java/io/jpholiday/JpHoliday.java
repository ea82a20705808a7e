package io.jpholiday;

import io.jpholiday.eval.Resolver;
import io.jpholiday.rule.DateRule;
import io.jpholiday.rule.HolidayKind;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The main entry point for Japanese national holiday lookups.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Optional<Holiday> holiday = JpHoliday.getHoliday(LocalDate.of(2024, 1, 8));
 * holiday.ifPresent(h -> System.out.println(h.name())); // 成人の日
 *
 * List<Holiday> goldenWeek =
 *     JpHoliday.getHolidays(LocalDate.of(2019, 4, 27), LocalDate.of(2019, 5, 6));
 * }</pre>
 *
 * <p>All queries are pure functions of their arguments and the built-in rule table, and are safe
 * to call from any thread.
 */
public final class JpHoliday {

  private JpHoliday() {}

  /**
   * Checks if the date is a holiday of any kind.
   *
   * @param date the date to check
   * @return true if a holiday falls on the date
   */
  public static boolean isHoliday(LocalDate date) {
    return getHoliday(date).isPresent();
  }

  /**
   * Checks if any holiday falls between the two dates.
   *
   * @param start the first date (inclusive)
   * @param end the last date (inclusive)
   * @return true if at least one holiday exists in the range; false when end is before start
   */
  public static boolean existsHoliday(LocalDate start, LocalDate end) {
    return holidays(start, end).findFirst().isPresent();
  }

  /**
   * Returns the holiday falling on the date.
   *
   * @param date the date to check
   * @return the holiday, or empty if the date is not a holiday
   */
  public static Optional<Holiday> getHoliday(LocalDate date) {
    Objects.requireNonNull(date, "date");
    return Resolver.standard().resolve(date);
  }

  /**
   * Returns every holiday between the two dates, in date order.
   *
   * @param start the first date (inclusive)
   * @param end the last date (inclusive)
   * @return an immutable list of holidays; empty when none exist or end is before start
   */
  public static List<Holiday> getHolidays(LocalDate start, LocalDate end) {
    return holidays(start, end).toList();
  }

  /**
   * Returns a lazy stream of holidays between the two dates, in date order.
   *
   * @param start the first date (inclusive)
   * @param end the last date (inclusive)
   * @return a stream of holidays; empty when end is before start
   */
  public static Stream<Holiday> holidays(LocalDate start, LocalDate end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    return Resolver.standard().between(start, end);
  }

  /**
   * Returns the first holiday strictly after the date.
   *
   * @param from the reference date (exclusive)
   * @return the next holiday, or empty if none exists within 1000 days
   */
  public static Optional<Holiday> nextHoliday(LocalDate from) {
    Objects.requireNonNull(from, "from");
    return Resolver.standard().nextFrom(from);
  }

  /**
   * Returns the last holiday strictly before the date.
   *
   * @param from the reference date (exclusive)
   * @return the previous holiday, or empty if none exists within 1000 days
   */
  public static Optional<Holiday> previousHoliday(LocalDate from) {
    Objects.requireNonNull(from, "from");
    return Resolver.standard().previousFrom(from);
  }

  /**
   * Returns the kind of holiday falling on the date.
   *
   * @param date the date to check
   * @return the holiday kind, or empty if the date is not a holiday
   */
  public static Optional<HolidayKind> kindOf(LocalDate date) {
    Objects.requireNonNull(date, "date");
    return Resolver.standard().find(date, true, true).map(DateRule::kind);
  }

  /**
   * Constructs a calendar date, rejecting out-of-range fields.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of the month
   * @return the date
   * @throws HolidayException if the fields do not form a valid date
   */
  public static LocalDate date(int year, int month, int day) throws HolidayException {
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      throw HolidayException.date(e.getMessage(), year + "-" + month + "-" + day, e);
    }
  }

  /**
   * Parses an ISO-8601 calendar date such as {@code 2024-01-08}.
   *
   * @param input the date string
   * @return the date
   * @throws HolidayException if the input is not a valid ISO date
   */
  public static LocalDate parseDate(String input) throws HolidayException {
    Objects.requireNonNull(input, "input");
    try {
      return LocalDate.parse(input.trim());
    } catch (DateTimeParseException e) {
      throw HolidayException.parse("invalid ISO date: " + input, input, e);
    }
  }
}
