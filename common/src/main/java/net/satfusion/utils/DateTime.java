// This file is part of SatFusion.
// Copyright (C) 2026  The SatFusion Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.satfusion.utils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.google.common.base.Strings;

/**
 * Utility class for parsing durations and ISO 8601 timestamps. All times 
 * are milliseconds since the Unix epoch in UTC.
 * 
 * @since 1.0
 */
public class DateTime {

  /** Formatter used for log and error messages. */
  private static final DateTimeFormatter ISO_FORMAT = 
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
          .withZone(ZoneOffset.UTC);
  
  /**
   * Parses a duration of the form {@code <integer><unit>} and returns the 
   * value in milliseconds. Zero is a valid duration.
   * <p>
   * Units:
   * <ul>
   * <li>ms - milliseconds</li>
   * <li>s - seconds</li>
   * <li>m - minutes</li>
   * <li>h - hours</li>
   * <li>d - days</li>
   * <li>w - weeks</li>
   * </ul>
   * @param duration The non-null and non-empty duration.
   * @return The duration in milliseconds.
   * @throws IllegalArgumentException if the duration was null, empty, 
   * negative or had an unknown unit.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    final String lower = duration.trim().toLowerCase();
    int unit = 0;
    while (unit < lower.length() && Character.isDigit(lower.charAt(unit))) {
      unit++;
    }
    if (unit == 0 || unit >= lower.length()) {
      throw new IllegalArgumentException("Invalid duration, must have an "
          + "integer and unit: " + duration);
    }
    final long interval;
    try {
      interval = Long.parseLong(lower.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " 
          + duration, e);
    }
    final long multiplier;
    switch (lower.substring(unit)) {
    case "ms":
      multiplier = 1;
      break;
    case "s":
      multiplier = 1000;
      break;
    case "m":
      multiplier = 60 * 1000;
      break;
    case "h":
      multiplier = 3600 * 1000;
      break;
    case "d":
      multiplier = 24 * 3600 * 1000L;
      break;
    case "w":
      multiplier = 7 * 24 * 3600 * 1000L;
      break;
    default:
      throw new IllegalArgumentException("Invalid duration (suffix): " 
          + duration);
    }
    if ((double) interval * multiplier > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE "
          + "ms: " + duration);
    }
    return interval * multiplier;
  }
  
  /**
   * Parses an ISO 8601 timestamp. A timestamp without a zone designator is
   * taken as UTC.
   * @param datetime The non-null and non-empty timestamp, e.g. 
   * {@code 2016-01-01T00:00:00Z}.
   * @return The time in milliseconds.
   * @throws IllegalArgumentException if the timestamp could not be parsed.
   */
  public static final long parseDateTimeString(final String datetime) {
    if (Strings.isNullOrEmpty(datetime)) {
      throw new IllegalArgumentException("Timestamp cannot be null or empty.");
    }
    try {
      return Instant.parse(datetime).toEpochMilli();
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(datetime).toInstant(ZoneOffset.UTC)
            .toEpochMilli();
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("Invalid timestamp: " 
            + datetime, ex);
      }
    }
  }
  
  /**
   * @param timestamp A time in milliseconds.
   * @return The ISO 8601 UTC representation with millisecond precision.
   */
  public static final String format(final long timestamp) {
    return ISO_FORMAT.format(Instant.ofEpochMilli(timestamp));
  }
  
  /** @return The current time in milliseconds. */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }
}
