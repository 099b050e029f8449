package com.nfservice.plugboleto.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the date strings found in PlugBoleto payloads.
 *
 * <p>The service uses {@code dd/MM/yyyy} with an optional {@code HH:mm[:ss]} part; ISO dates
 * are accepted as well.
 */
public final class ServiceDates {

  private static final DateTimeFormatter BR_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

  private ServiceDates() {
  }

  /** Date part only; the time part, when present, is dropped. Blank input yields null. */
  public static LocalDate parseDate(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String datePart = raw.trim().split("[ T]")[0];
    try {
      if (datePart.indexOf('/') >= 0) {
        return LocalDate.parse(datePart, BR_DATE);
      }
      return LocalDate.parse(datePart);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Unparseable service date: " + raw, e);
    }
  }

  /** Date and time; a missing time part means midnight. Blank input yields null. */
  public static LocalDateTime parseDateTime(String raw) {
    LocalDate date = parseDate(raw);
    if (date == null) {
      return null;
    }
    String[] parts = raw.trim().split("[ T]");
    if (parts.length < 2 || parts[1].isBlank()) {
      return date.atStartOfDay();
    }
    try {
      return date.atTime(LocalTime.parse(parts[1]));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Unparseable service time: " + raw, e);
    }
  }
}
