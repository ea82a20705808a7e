package io.jpholiday.rule;

import java.time.LocalDate;

/**
 * Approximates the day of an equinox within its month.
 *
 * <p>The day is {@code (int) (constant + 0.242194 * (year - 1980)) - (int) ((year - leapBase) /
 * 4.0)}. Both casts truncate toward zero. Each formula is only valid for the year range its rule
 * covers.
 *
 * @param constant the day constant for the era
 * @param leapBase the year from which leap corrections are counted
 */
public record EquinoxFormula(double constant, int leapBase) implements DatePredicate {

  /** Mean drift of the equinox per year, in days. */
  static final double DRIFT = 0.242194;

  public static final EquinoxFormula VERNAL_1949 = new EquinoxFormula(20.8357, 1983);
  public static final EquinoxFormula VERNAL_1980 = new EquinoxFormula(20.8431, 1980);
  public static final EquinoxFormula VERNAL_2100 = new EquinoxFormula(21.8510, 1980);

  public static final EquinoxFormula AUTUMNAL_1948 = new EquinoxFormula(23.2588, 1983);
  public static final EquinoxFormula AUTUMNAL_1980 = new EquinoxFormula(23.2488, 1980);
  public static final EquinoxFormula AUTUMNAL_2100 = new EquinoxFormula(24.2488, 1980);

  /**
   * Computes the equinox day of the month for the given year.
   *
   * @param year the year
   * @return the day of the month
   */
  public int dayOf(int year) {
    return (int) (constant + DRIFT * (year - 1980)) - (int) ((year - leapBase) / 4.0);
  }

  @Override
  public boolean test(LocalDate date, HolidayLookup holidays) {
    return date.getDayOfMonth() == dayOf(date.getYear());
  }
}
