package io.jpholiday;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A holiday observed on a specific date.
 *
 * @param name the holiday name
 * @param date the date it falls on
 */
public record Holiday(String name, LocalDate date) {

  public Holiday {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(date, "date");
  }
}
