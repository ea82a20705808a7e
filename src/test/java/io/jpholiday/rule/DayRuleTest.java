package io.jpholiday.rule;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for the day rule variants. */
public class DayRuleTest {

  private static List<LocalDate> matchingDays(DayRule rule, YearMonth month) {
    List<LocalDate> days = new ArrayList<>();
    for (int d = 1; d <= month.lengthOfMonth(); d++) {
      LocalDate date = month.atDay(d);
      if (rule.matches(date, HolidayLookup.NONE)) {
        days.add(date);
      }
    }
    return days;
  }

  @Test
  void testFixedDay() {
    DayRule rule = DayRule.just(11);
    assertInstanceOf(FixedDay.class, rule);
    assertEquals(
        List.of(LocalDate.of(2024, 2, 11)), matchingDays(rule, YearMonth.of(2024, 2)));
  }

  @Test
  void testFixedDayOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> DayRule.just(0));
    assertThrows(IllegalArgumentException.class, () -> DayRule.just(32));
  }

  @Test
  void testSecondMondayWhenMonthStartsOnMonday() {
    // 2024-01-01 is a Monday.
    DayRule rule = DayRule.weekday(WeekOfMonth.SECOND, DayOfWeek.MONDAY);
    assertEquals(List.of(LocalDate.of(2024, 1, 8)), matchingDays(rule, YearMonth.of(2024, 1)));
  }

  @Test
  void testSecondMondayWrapsIntoFollowingWeek() {
    // 2024-10-01 is a Tuesday, so the first Monday is the 7th.
    DayRule rule = DayRule.weekday(WeekOfMonth.SECOND, DayOfWeek.MONDAY);
    assertEquals(List.of(LocalDate.of(2024, 10, 14)), matchingDays(rule, YearMonth.of(2024, 10)));
  }

  @Test
  void testThirdMondayWhenMonthStartsOnSunday() {
    // 2024-09-01 is a Sunday.
    DayRule rule = DayRule.weekday(WeekOfMonth.THIRD, DayOfWeek.MONDAY);
    assertEquals(List.of(LocalDate.of(2024, 9, 16)), matchingDays(rule, YearMonth.of(2024, 9)));
  }

  @Test
  void testSundayTargetWhenMonthStartsOnSaturday() {
    // 2024-06-01 is a Saturday.
    DayRule rule = DayRule.weekday(WeekOfMonth.FIRST, DayOfWeek.SUNDAY);
    assertEquals(List.of(LocalDate.of(2024, 6, 2)), matchingDays(rule, YearMonth.of(2024, 6)));
  }

  @Test
  void testFifthOccurrenceInsideMonth() {
    // February 2024 starts on a Thursday and has 29 days.
    DayRule rule = DayRule.weekday(WeekOfMonth.FIFTH, DayOfWeek.THURSDAY);
    assertEquals(List.of(LocalDate.of(2024, 2, 29)), matchingDays(rule, YearMonth.of(2024, 2)));
  }

  @Test
  void testFifthOccurrenceOverflowingMonthNeverMatches() {
    NthWeekday rule = new NthWeekday(WeekOfMonth.FIFTH, DayOfWeek.MONDAY);
    assertEquals(LocalDate.of(2024, 3, 4), rule.occurrenceIn(LocalDate.of(2024, 2, 15)));
    assertTrue(matchingDays(rule, YearMonth.of(2024, 2)).isEmpty());
  }

  @Test
  void testNthWeekdayAgreesWithCalendarForEveryMonth() {
    for (int year = 1990; year <= 2030; year++) {
      for (int month = 1; month <= 12; month++) {
        YearMonth ym = YearMonth.of(year, month);
        for (WeekOfMonth week : WeekOfMonth.values()) {
          for (DayOfWeek dow : DayOfWeek.values()) {
            List<LocalDate> expected = new ArrayList<>();
            int seen = 0;
            for (int d = 1; d <= ym.lengthOfMonth(); d++) {
              LocalDate date = ym.atDay(d);
              if (date.getDayOfWeek() == dow && ++seen == week.number()) {
                expected.add(date);
              }
            }
            assertEquals(
                expected,
                matchingDays(DayRule.weekday(week, dow), ym),
                ym + " " + week + " " + dow);
          }
        }
      }
    }
  }

  @Test
  void testComputedDayReceivesLookup() {
    LocalDate marker = LocalDate.of(2024, 5, 3);
    DayRule rule = DayRule.computed((date, holidays) -> holidays.isHoliday(date.minusDays(1)));
    assertTrue(rule.matches(LocalDate.of(2024, 5, 4), marker::equals));
    assertFalse(rule.matches(LocalDate.of(2024, 5, 5), marker::equals));
    assertFalse(rule.matches(LocalDate.of(2024, 5, 4), HolidayLookup.NONE));
  }

  @Test
  void testWeekOfMonthNumbers() {
    assertEquals(1, WeekOfMonth.FIRST.number());
    assertEquals(5, WeekOfMonth.FIFTH.number());
    assertEquals("third", WeekOfMonth.THIRD.toString());
  }
}
