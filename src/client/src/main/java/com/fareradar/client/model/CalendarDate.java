package com.fareradar.client.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Concrete leg date. Keeps the time of day because departures are checked against the current
 * instant, while only year, month and day go on the wire.
 */
public record CalendarDate(LocalDateTime dateTime) implements TravelDate {
  public CalendarDate {
    Objects.requireNonNull(dateTime, "dateTime");
  }

  public static CalendarDate of(LocalDateTime dateTime) {
    return new CalendarDate(dateTime);
  }

  public static CalendarDate of(int year, int month, int day) {
    return new CalendarDate(LocalDate.of(year, month, day).atStartOfDay());
  }

  public int year() {
    return dateTime.getYear();
  }

  public int month() {
    return dateTime.getMonthValue();
  }

  public int day() {
    return dateTime.getDayOfMonth();
  }

  public boolean isBefore(CalendarDate other) {
    return dateTime.isBefore(other.dateTime);
  }
}
