package io.jpholiday.eval;

import io.jpholiday.Holiday;
import io.jpholiday.rule.DateRule;
import io.jpholiday.rule.HolidayKind;
import io.jpholiday.rule.HolidayLookup;
import io.jpholiday.rule.HolidayRules;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves dates against an ordered rule table.
 *
 * <h2>First match wins</h2>
 *
 * <p>Rules are scanned in table order and the first rule whose year, month and day predicates all
 * hold names the date. Disjoint year ranges are not assumed.
 *
 * <h2>Recursion</h2>
 *
 * <p>Computed day rules receive a {@link HolidayLookup} that resolves with substitute and national
 * rules excluded. A substitute or national predicate can therefore only ever trigger evaluation of
 * genuine holiday rules, and recursion is at most one level deep.
 *
 * <h2>Search limits</h2>
 *
 * <p>{@link #nextFrom} and {@link #previousFrom} give up after {@value #MAX_ITERATIONS} days. Under
 * the standard table the longest gap between holidays is well under that.
 */
public final class Resolver {
  private static final Logger LOG = LoggerFactory.getLogger(Resolver.class);

  /** Maximum days scanned by next/previous searches. */
  static final int MAX_ITERATIONS = 1000;

  private static final Resolver STANDARD = new Resolver(HolidayRules.TABLE);

  private final List<DateRule> rules;
  private final HolidayLookup holidaysOnly;

  /**
   * Creates a resolver over the given rule table.
   *
   * @param rules the ordered rules; copied
   */
  public Resolver(List<DateRule> rules) {
    this.rules = List.copyOf(rules);
    this.holidaysOnly = date -> find(date, false, false).isPresent();
    LOG.debug("Resolver built over {} rules", this.rules.size());
  }

  /**
   * Returns the resolver over the Japanese national holiday table.
   *
   * @return the shared resolver
   */
  public static Resolver standard() {
    return STANDARD;
  }

  /**
   * Returns the rule table this resolver scans.
   *
   * @return the immutable rule list
   */
  public List<DateRule> rules() {
    return rules;
  }

  /**
   * Finds the first rule matching the date, skipping excluded kinds.
   *
   * @param date the date to resolve
   * @param includeSubstitute whether substitute holiday rules are considered
   * @param includeNational whether national holiday rules are considered
   * @return the first matching rule, or empty if none matches
   */
  public Optional<DateRule> find(
      LocalDate date, boolean includeSubstitute, boolean includeNational) {
    for (DateRule rule : rules) {
      if (!includeSubstitute && rule.kind() == HolidayKind.SUBSTITUTE_HOLIDAY) {
        continue;
      }
      if (!includeNational && rule.kind() == HolidayKind.NATIONAL_HOLIDAY) {
        continue;
      }
      if (rule.matches(date, holidaysOnly)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the date to a holiday, skipping excluded kinds.
   *
   * @param date the date to resolve
   * @param includeSubstitute whether substitute holiday rules are considered
   * @param includeNational whether national holiday rules are considered
   * @return the holiday, or empty if none falls on the date
   */
  public Optional<Holiday> resolve(
      LocalDate date, boolean includeSubstitute, boolean includeNational) {
    return find(date, includeSubstitute, includeNational)
        .map(rule -> new Holiday(rule.name(), date));
  }

  /**
   * Resolves the date with every rule kind considered.
   *
   * @param date the date to resolve
   * @return the holiday, or empty if none falls on the date
   */
  public Optional<Holiday> resolve(LocalDate date) {
    return resolve(date, true, true);
  }

  /**
   * Returns a lazy stream of holidays where start &lt;= date &lt;= end, in date order.
   *
   * @param start the first date (inclusive)
   * @param end the last date (inclusive)
   * @return a stream of holidays, empty when end is before start
   */
  public Stream<Holiday> between(LocalDate start, LocalDate end) {
    if (end.isBefore(start)) {
      return Stream.empty();
    }
    LOG.debug("Scanning holidays from {} to {}", start, end);
    // datesUntil excludes end; stepping past end would overflow at LocalDate.MAX.
    return Stream.concat(start.datesUntil(end), Stream.of(end))
        .map(this::resolve)
        .flatMap(Optional::stream);
  }

  /**
   * Finds the first holiday strictly after the given date.
   *
   * @param from the reference date (exclusive)
   * @return the next holiday, or empty if none is found within the search limit
   */
  public Optional<Holiday> nextFrom(LocalDate from) {
    LocalDate date = from;
    for (int i = 0; i < MAX_ITERATIONS && date.isBefore(LocalDate.MAX); i++) {
      date = date.plusDays(1);
      Optional<Holiday> holiday = resolve(date);
      if (holiday.isPresent()) {
        return holiday;
      }
    }
    LOG.debug("No holiday within {} days after {}", MAX_ITERATIONS, from);
    return Optional.empty();
  }

  /**
   * Finds the last holiday strictly before the given date.
   *
   * @param from the reference date (exclusive)
   * @return the previous holiday, or empty if none is found within the search limit
   */
  public Optional<Holiday> previousFrom(LocalDate from) {
    LocalDate date = from;
    for (int i = 0; i < MAX_ITERATIONS && date.isAfter(LocalDate.MIN); i++) {
      date = date.minusDays(1);
      Optional<Holiday> holiday = resolve(date);
      if (holiday.isPresent()) {
        return holiday;
      }
    }
    LOG.debug("No holiday within {} days before {}", MAX_ITERATIONS, from);
    return Optional.empty();
  }
}
