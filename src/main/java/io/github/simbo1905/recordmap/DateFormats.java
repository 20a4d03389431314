// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQuery;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.recordmap.RecordMapper.LOGGER;

/// Compiled `DateTimeFormatter`s keyed by pattern, plus the parse query of each supported temporal class.
/// `Instant` values are rendered and parsed in UTC, every other class in its own zone or offset if it has one.
final class DateFormats {

  static final Map<String, DateTimeFormatter> FORMATTERS = new ConcurrentHashMap<>();

  static final Map<Class<?>, TemporalQuery<?>> QUERIES = Map.<Class<?>, TemporalQuery<?>>of(
      LocalDate.class, LocalDate::from,
      LocalDateTime.class, LocalDateTime::from,
      LocalTime.class, LocalTime::from,
      OffsetDateTime.class, OffsetDateTime::from,
      ZonedDateTime.class, ZonedDateTime::from,
      Instant.class, Instant::from,
      YearMonth.class, YearMonth::from);

  static final Map<Class<?>, TemporalAccessor> SAMPLES = Map.<Class<?>, TemporalAccessor>of(
      LocalDate.class, LocalDate.of(2000, 1, 2),
      LocalDateTime.class, LocalDateTime.of(2000, 1, 2, 3, 4, 5),
      LocalTime.class, LocalTime.of(3, 4, 5),
      OffsetDateTime.class, OffsetDateTime.of(2000, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC),
      ZonedDateTime.class, ZonedDateTime.of(2000, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC),
      Instant.class, Instant.ofEpochSecond(946782245L),
      YearMonth.class, YearMonth.of(2000, 1));

  private DateFormats() {
  }

  /// @throws IllegalArgumentException when the pattern does not compile
  static DateTimeFormatter formatter(String pattern) {
    return FORMATTERS.computeIfAbsent(pattern, p -> {
      LOGGER.finer(() -> "Compiling date pattern '" + p + "'");
      return DateTimeFormatter.ofPattern(p);
    });
  }

  /// Checks once, at resolution time, that the pattern compiles, can render the given class and can
  /// read back what it rendered.
  /// @throws IllegalArgumentException describing why not
  static void verify(String pattern, Class<?> temporalType) {
    final DateTimeFormatter formatter = zoned(formatter(pattern), temporalType);
    final String sample;
    try {
      sample = formatter.format(SAMPLES.get(temporalType));
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("pattern '" + pattern + "' cannot render "
          + temporalType.getSimpleName() + ": " + e.getMessage(), e);
    }
    try {
      formatter.parse(sample, QUERIES.get(temporalType));
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("pattern '" + pattern + "' cannot parse the "
          + temporalType.getSimpleName() + " text '" + sample + "' it renders: " + e.getMessage(), e);
    }
  }

  static String format(TemporalAccessor value, String pattern) {
    return zoned(formatter(pattern), value.getClass()).format(value);
  }

  /// @throws java.time.format.DateTimeParseException when the text does not match
  static Object parse(String text, Class<?> temporalType, String pattern) {
    return zoned(formatter(pattern), temporalType).parse(text, QUERIES.get(temporalType));
  }

  private static DateTimeFormatter zoned(DateTimeFormatter formatter, Class<?> temporalType) {
    return temporalType == Instant.class ? formatter.withZone(ZoneOffset.UTC) : formatter;
  }
}
