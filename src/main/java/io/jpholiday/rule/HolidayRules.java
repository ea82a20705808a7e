package io.jpholiday.rule;

import static io.jpholiday.rule.DateRule.holiday;
import static io.jpholiday.rule.DateRule.national;
import static io.jpholiday.rule.DateRule.substitute;
import static io.jpholiday.rule.WeekOfMonth.SECOND;
import static io.jpholiday.rule.WeekOfMonth.THIRD;
import static java.time.DayOfWeek.MONDAY;
import static java.time.Month.APRIL;
import static java.time.Month.AUGUST;
import static java.time.Month.DECEMBER;
import static java.time.Month.FEBRUARY;
import static java.time.Month.JANUARY;
import static java.time.Month.JULY;
import static java.time.Month.JUNE;
import static java.time.Month.MARCH;
import static java.time.Month.MAY;
import static java.time.Month.NOVEMBER;
import static java.time.Month.OCTOBER;
import static java.time.Month.SEPTEMBER;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * The Japanese national holiday table.
 *
 * <h2>Ordering</h2>
 *
 * <p>Rules are evaluated in list order and the first match wins. Every amendment of the law is a
 * separate entry with its own year range, so the same name may appear several times. Genuine
 * holidays come first; the substitute and national rules come last because they are defined in
 * terms of the genuine ones.
 *
 * <p>2020 and 2021 carry one-off dates for 海の日, スポーツの日 and 山の日, moved around the Tokyo
 * Olympics.
 *
 * <h2>Substitute holidays (振替休日)</h2>
 *
 * <ul>
 *   <li>From 1973-04-12 to 2006: the day after a holiday falling on a Sunday.
 *   <li>From 2007: the first non-holiday after a run of consecutive holidays that includes a
 *       Sunday.
 * </ul>
 *
 * <h2>National holidays (国民の休日)</h2>
 *
 * <p>From 1986: a day other than Sunday whose previous and next days are both holidays.
 */
public final class HolidayRules {

  /** The day the substitute holiday amendment took effect. */
  public static final LocalDate SUBSTITUTE_HOLIDAY_START = LocalDate.of(1973, 4, 12);

  /** The ordered, immutable rule table. */
  public static final List<DateRule> TABLE =
      List.of(
          holiday("元日", YearRule.after(1949), MonthRule.just(JANUARY), DayRule.just(1)),
          holiday(
              "成人の日",
              YearRule.after(2000),
              MonthRule.just(JANUARY),
              DayRule.weekday(SECOND, MONDAY)),
          holiday("成人の日", YearRule.range(1949, 1999), MonthRule.just(JANUARY), DayRule.just(15)),
          holiday("建国記念の日", YearRule.after(1967), MonthRule.just(FEBRUARY), DayRule.just(11)),
          holiday("昭和の日", YearRule.after(2007), MonthRule.just(APRIL), DayRule.just(29)),
          holiday("憲法記念日", YearRule.after(1949), MonthRule.just(MAY), DayRule.just(3)),
          holiday("みどりの日", YearRule.after(2007), MonthRule.just(MAY), DayRule.just(4)),
          holiday("みどりの日", YearRule.range(1989, 2006), MonthRule.just(APRIL), DayRule.just(29)),
          holiday("こどもの日", YearRule.after(1949), MonthRule.just(MAY), DayRule.just(5)),
          holiday(
              "海の日", YearRule.after(2022), MonthRule.just(JULY), DayRule.weekday(THIRD, MONDAY)),
          holiday("海の日", YearRule.just(2021), MonthRule.just(JULY), DayRule.just(22)),
          holiday("海の日", YearRule.just(2020), MonthRule.just(JULY), DayRule.just(23)),
          holiday(
              "海の日",
              YearRule.range(2003, 2019),
              MonthRule.just(JULY),
              DayRule.weekday(THIRD, MONDAY)),
          holiday("海の日", YearRule.range(1996, 2002), MonthRule.just(JULY), DayRule.just(20)),
          holiday("山の日", YearRule.after(2022), MonthRule.just(AUGUST), DayRule.just(11)),
          holiday("山の日", YearRule.just(2021), MonthRule.just(AUGUST), DayRule.just(8)),
          holiday("山の日", YearRule.just(2020), MonthRule.just(AUGUST), DayRule.just(10)),
          holiday("山の日", YearRule.range(2016, 2019), MonthRule.just(AUGUST), DayRule.just(11)),
          holiday(
              "敬老の日",
              YearRule.after(2003),
              MonthRule.just(SEPTEMBER),
              DayRule.weekday(THIRD, MONDAY)),
          holiday("敬老の日", YearRule.range(1966, 2002), MonthRule.just(SEPTEMBER), DayRule.just(15)),
          holiday(
              "体育の日",
              YearRule.range(2000, 2019),
              MonthRule.just(OCTOBER),
              DayRule.weekday(SECOND, MONDAY)),
          holiday("体育の日", YearRule.range(1966, 1999), MonthRule.just(OCTOBER), DayRule.just(10)),
          holiday(
              "スポーツの日",
              YearRule.after(2022),
              MonthRule.just(OCTOBER),
              DayRule.weekday(SECOND, MONDAY)),
          holiday("スポーツの日", YearRule.just(2021), MonthRule.just(JULY), DayRule.just(23)),
          holiday("スポーツの日", YearRule.just(2020), MonthRule.just(JULY), DayRule.just(24)),
          holiday("文化の日", YearRule.after(1948), MonthRule.just(NOVEMBER), DayRule.just(3)),
          holiday("勤労感謝の日", YearRule.after(1948), MonthRule.just(NOVEMBER), DayRule.just(23)),
          holiday("天皇誕生日", YearRule.after(2020), MonthRule.just(FEBRUARY), DayRule.just(23)),
          holiday("天皇誕生日", YearRule.range(1989, 2018), MonthRule.just(DECEMBER), DayRule.just(23)),
          holiday("天皇誕生日", YearRule.range(1949, 1988), MonthRule.just(APRIL), DayRule.just(29)),
          holiday(
              "春分の日",
              YearRule.range(1949, 1979),
              MonthRule.just(MARCH),
              DayRule.computed(EquinoxFormula.VERNAL_1949)),
          holiday(
              "春分の日",
              YearRule.range(1980, 2099),
              MonthRule.just(MARCH),
              DayRule.computed(EquinoxFormula.VERNAL_1980)),
          holiday(
              "春分の日",
              YearRule.range(2100, 2150),
              MonthRule.just(MARCH),
              DayRule.computed(EquinoxFormula.VERNAL_2100)),
          holiday(
              "秋分の日",
              YearRule.range(1948, 1979),
              MonthRule.just(SEPTEMBER),
              DayRule.computed(EquinoxFormula.AUTUMNAL_1948)),
          holiday(
              "秋分の日",
              YearRule.range(1980, 2099),
              MonthRule.just(SEPTEMBER),
              DayRule.computed(EquinoxFormula.AUTUMNAL_1980)),
          holiday(
              "秋分の日",
              YearRule.range(2100, 2150),
              MonthRule.just(SEPTEMBER),
              DayRule.computed(EquinoxFormula.AUTUMNAL_2100)),
          holiday("即位礼正殿の儀", YearRule.just(2019), MonthRule.just(OCTOBER), DayRule.just(22)),
          holiday("即位礼正殿の儀", YearRule.just(1990), MonthRule.just(NOVEMBER), DayRule.just(12)),
          holiday("天皇の即位の日", YearRule.just(2019), MonthRule.just(MAY), DayRule.just(1)),
          holiday("皇太子徳仁親王の結婚の儀", YearRule.just(1993), MonthRule.just(JUNE), DayRule.just(9)),
          holiday("昭和天皇の大喪の礼", YearRule.just(1989), MonthRule.just(FEBRUARY), DayRule.just(24)),
          holiday("皇太子明仁親王の結婚の儀", YearRule.just(1959), MonthRule.just(APRIL), DayRule.just(10)),
          substitute(
              "振替休日",
              YearRule.after(2007),
              MonthRule.any(),
              DayRule.computed(HolidayRules::followsSundayRun)),
          substitute(
              "振替休日",
              YearRule.range(1973, 2006),
              MonthRule.any(),
              DayRule.computed(HolidayRules::followsSundayHoliday)),
          national(
              "国民の休日",
              YearRule.after(1986),
              MonthRule.any(),
              DayRule.computed(HolidayRules::isSandwiched)));

  private HolidayRules() {}

  /**
   * Substitute holiday rule in force from 2007.
   *
   * <p>Walks back over the run of holidays immediately preceding the date. The date qualifies if
   * any day in that run is a Sunday.
   */
  static boolean followsSundayRun(LocalDate date, HolidayLookup holidays) {
    LocalDate day = date.minusDays(1);
    while (holidays.isHoliday(day)) {
      if (day.getDayOfWeek() == DayOfWeek.SUNDAY) {
        return true;
      }
      day = day.minusDays(1);
    }
    return false;
  }

  /** Substitute holiday rule in force from 1973-04-12 to 2006: a holiday on the Sunday before. */
  static boolean followsSundayHoliday(LocalDate date, HolidayLookup holidays) {
    if (date.isBefore(SUBSTITUTE_HOLIDAY_START)) {
      return false;
    }
    LocalDate previous = date.minusDays(1);
    return previous.getDayOfWeek() == DayOfWeek.SUNDAY && holidays.isHoliday(previous);
  }

  /** National holiday rule: not a Sunday, with holidays on both sides. */
  static boolean isSandwiched(LocalDate date, HolidayLookup holidays) {
    if (date.getDayOfWeek() == DayOfWeek.SUNDAY) {
      return false;
    }
    return holidays.isHoliday(date.minusDays(1)) && holidays.isHoliday(date.plusDays(1));
  }
}
