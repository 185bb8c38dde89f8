package com.simhub.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Приводит время из сообщений шлюза к каноническому виду
 * {@code yyyy-MM-dd HH:mm:ss} в поясе UTC+8 без суффикса.
 * <p>
 * Шлюз передаёт время по часам своей SIM-сети: epoch-значение или строка без
 * пояса считается "настенным" время пояса оператора. Поэтому сначала вычитается
 * смещение пояса SIM-карты (часы к востоку от UTC), затем время выводится в UTC+8:
 * {@code canonical = raw - offset*3600 + 8*3600}. Формула верна и для отрицательных смещений.
 * Строка с явным поясом ({@code Z}, {@code +03:00}) задаёт абсолютный момент, смещение SIM к ней не применяется.
 */
public class TimeNormalizer {

  private static final Logger logger = LoggerFactory.getLogger(TimeNormalizer.class);

  public static final ZoneOffset CANONICAL_ZONE = ZoneOffset.ofHours(8);
  public static final DateTimeFormatter CANONICAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  /** Epoch-значения меньше порога считаются секундами, остальные миллисекундами. */
  static final long MILLIS_THRESHOLD = 10_000_000_000L;

  /** Каноническая строка умещается в 19 символов только для четырёхзначного года. */
  private static final int MIN_YEAR = 0;
  private static final int MAX_YEAR = 9999;

  private static final Pattern EPOCH = Pattern.compile("-?\\d{1,18}");

  private final Clock clock;

  public TimeNormalizer() {
    this(Clock.systemUTC());
  }

  public TimeNormalizer(Clock clock) {
    this.clock = clock;
  }

  /**
   * @return Текущее время в каноническом формате.
   */
  public String now() {
    return render(clock.instant());
  }

  /**
   * @param seconds Сколько секунд назад.
   * @return Момент {@code now - seconds} в каноническом формате.
   */
  public String secondsAgo(long seconds) {
    return render(clock.instant().minusSeconds(seconds));
  }

  /**
   * Нормализует время из сообщения.
   *
   * @param rawTime Epoch (секунды или миллисекунды), строка с датой или {@code null}.
   * @param sourceOffsetHours Пояс SIM-карты в часах к востоку от UTC.
   * @return Каноническое время; при отсутствии или нераспознаваемом значении текущее.
   */
  public String normalize(Object rawTime, int sourceOffsetHours) {
    if (rawTime == null) {
      return now();
    }
    Instant wallClock = null;
    if (rawTime instanceof Number) {
      wallClock = fromEpoch(((Number) rawTime).longValue());
    } else {
      String text = rawTime.toString().trim();
      if (text.isEmpty()) {
        return now();
      }
      if (EPOCH.matcher(text).matches()) {
        wallClock = fromEpoch(Long.parseLong(text));
      } else {
        Instant absolute = parseAbsolute(text);
        if (absolute != null) {
          return renderOrNow(absolute, rawTime);
        }
        wallClock = parseWallClock(text);
      }
    }
    if (wallClock == null) {
      logger.debug("Не удалось разобрать время '{}', используется текущее", rawTime);
      return now();
    }
    return renderOrNow(wallClock.minusSeconds(sourceOffsetHours * 3600L), rawTime);
  }

  private String renderOrNow(Instant instant, Object rawTime) {
    LocalDateTime local = LocalDateTime.ofInstant(instant, CANONICAL_ZONE);
    if (local.getYear() < MIN_YEAR || local.getYear() > MAX_YEAR) {
      logger.debug("Время '{}' вне диапазона {}..{} лет, используется текущее", rawTime, MIN_YEAR, MAX_YEAR);
      return now();
    }
    return local.format(CANONICAL_FORMAT);
  }

  /**
   * Приводит epoch-значение к секундам по тому же правилу, что и {@link #normalize}.
   *
   * @return Секунды или {@code null}, если значение не числовое.
   */
  public static Long toEpochSeconds(Object rawTime) {
    long value;
    if (rawTime instanceof Number) {
      value = ((Number) rawTime).longValue();
    } else if (rawTime != null && EPOCH.matcher(rawTime.toString().trim()).matches()) {
      value = Long.parseLong(rawTime.toString().trim());
    } else {
      return null;
    }
    return Math.abs(value) < MILLIS_THRESHOLD ? value : value / 1000;
  }

  private static Instant fromEpoch(long value) {
    return Math.abs(value) < MILLIS_THRESHOLD ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
  }

  private static Instant parseAbsolute(String text) {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static Instant parseWallClock(String text) {
    try {
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      // пробуем канонический формат
    }
    try {
      return LocalDateTime.parse(text, CANONICAL_FORMAT).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String render(Instant instant) {
    return LocalDateTime.ofInstant(instant, CANONICAL_ZONE).format(CANONICAL_FORMAT);
  }
}
