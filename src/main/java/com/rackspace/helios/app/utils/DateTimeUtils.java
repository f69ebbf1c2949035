package com.rackspace.helios.app.utils;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public class DateTimeUtils {

  private DateTimeUtils() {
  }

  /**
   * Checks if the string is an ISO-8601 timestamp carrying an explicit offset or <code>Z</code>.
   */
  public static boolean isValidOffsetTimestamp(String time) {
    try {
      OffsetDateTime.parse(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  /**
   * Parses an ISO-8601 timestamp with explicit offset into an instant.
   */
  public static Instant parseOffsetTimestamp(String time) {
    if (time == null) {
      throw new IllegalArgumentException("Timestamp is required");
    }
    try {
      return OffsetDateTime.parse(time).toInstant();
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Timestamp must be ISO-8601 with an explicit offset: " + time);
    }
  }

  /**
   * @return the number of whole intervals in <code>[start, end)</code>
   */
  public static int slotCount(Instant start, Instant end, Duration interval) {
    if (!start.isBefore(end)) {
      return 0;
    }
    final long seconds = Duration.between(start, end).getSeconds();
    return (int) ((seconds + interval.getSeconds() - 1) / interval.getSeconds());
  }

  /**
   * @return the index of the grid slot containing <code>ts</code>, counted from <code>start</code>
   */
  public static int slotIndex(Instant start, Instant ts, Duration interval) {
    return (int) Math.floorDiv(Duration.between(start, ts).getSeconds(), interval.getSeconds());
  }

  public static List<Instant> grid(Instant start, Instant end, Duration interval) {
    final List<Instant> slots = new ArrayList<>();
    for (Instant ts = start; ts.isBefore(end); ts = ts.plus(interval)) {
      slots.add(ts);
    }
    return slots;
  }

  /**
   * @return the phase of <code>ts</code> within a season of <code>period</code> intervals,
   * anchored at the epoch so that phases are stable across training and forecast ranges
   */
  public static int seasonalPhase(Instant ts, Duration interval, int period) {
    return (int) Math.floorMod(Math.floorDiv(ts.getEpochSecond(), interval.getSeconds()), (long) period);
  }

  public static LocalDateTime toLocalDateTime(Instant instant, ZoneId zone) {
    return instant.atZone(zone).toLocalDateTime();
  }
}
