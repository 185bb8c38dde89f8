package com.simhub.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TimeNormalizerTest {

  // 2023-11-14 22:13:20 UTC
  private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

  private final TimeNormalizer normalizer = new TimeNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  @DisplayName("Текущее время выводится в UTC+8")
  void shouldRenderNowInCanonicalZone() {
    assertThat(normalizer.now()).isEqualTo("2023-11-15 06:13:20");
    assertThat(normalizer.secondsAgo(3600)).isEqualTo("2023-11-15 05:13:20");
  }

  @Test
  @DisplayName("Epoch в секундах при поясе 0 сдвигается на +8 часов")
  void shouldNormalizeEpochSecondsWithZeroOffset() {
    assertThat(normalizer.normalize(1_700_000_000L, 0)).isEqualTo("2023-11-15 06:13:20");
    assertThat(normalizer.normalize("1700000000", 0)).isEqualTo("2023-11-15 06:13:20");
  }

  @Test
  @DisplayName("Epoch в миллисекундах распознаётся по величине")
  void shouldNormalizeEpochMillis() {
    assertThat(normalizer.normalize(1_700_000_000_000L, 0)).isEqualTo("2023-11-15 06:13:20");
  }

  @Test
  @DisplayName("Пояс SIM +8 даёт исходное настенное время")
  void shouldKeepWallClockForChinaOffset() {
    assertThat(normalizer.normalize(1_700_000_000L, 8)).isEqualTo("2023-11-14 22:13:20");
  }

  @Test
  @DisplayName("Отрицательный пояс SIM сдвигает время вперёд")
  void shouldHandleNegativeOffset() {
    assertThat(normalizer.normalize(1_700_000_000L, -5)).isEqualTo("2023-11-15 11:13:20");
  }

  @Test
  @DisplayName("Строка без пояса — настенное время SIM-сети")
  void shouldTreatZonelessStringAsWallClock() {
    assertThat(normalizer.normalize("2024-01-01 10:00:00", 3)).isEqualTo("2024-01-01 15:00:00");
    assertThat(normalizer.normalize("2024-01-01T10:00:00", 0)).isEqualTo("2024-01-01 18:00:00");
  }

  @Test
  @DisplayName("Строка с явным поясом — абсолютный момент, пояс SIM не применяется")
  void shouldTreatOffsetStringAsAbsolute() {
    assertThat(normalizer.normalize("2024-01-01T10:00:00Z", 5)).isEqualTo("2024-01-01 18:00:00");
    assertThat(normalizer.normalize("2024-01-01T10:00:00+03:00", 5)).isEqualTo("2024-01-01 15:00:00");
  }

  @Test
  @DisplayName("Пустое или нераспознанное значение → текущее время")
  void shouldFallBackToNow() {
    assertThat(normalizer.normalize(null, 0)).isEqualTo("2023-11-15 06:13:20");
    assertThat(normalizer.normalize("  ", 0)).isEqualTo("2023-11-15 06:13:20");
    assertThat(normalizer.normalize("yesterday", 0)).isEqualTo("2023-11-15 06:13:20");
  }

  @Test
  @DisplayName("Канонические строки сравниваются лексикографически в хронологическом порядке")
  void shouldProduceSortableStrings() {
    String earlier = normalizer.normalize(1_699_999_999L, 0);
    String later = normalizer.normalize(1_700_000_000L, 0);

    assertThat(earlier.compareTo(later)).isNegative();
  }

  @Test
  @DisplayName("toEpochSeconds приводит миллисекунды к секундам")
  void shouldConvertToEpochSeconds() {
    assertThat(TimeNormalizer.toEpochSeconds(1_700_000_000_000L)).isEqualTo(1_700_000_000L);
    assertThat(TimeNormalizer.toEpochSeconds("1700000000")).isEqualTo(1_700_000_000L);
    assertThat(TimeNormalizer.toEpochSeconds("2024-01-01")).isNull();
  }

  @Test
  @DisplayName("Время за пределами 9999 года заменяется текущим")
  void shouldFallBackToNowWhenYearOutOfRange() {
    assertThat(normalizer.normalize(300_000_000_000_000L, 0)).isEqualTo("2023-11-15 06:13:20");
    assertThat(normalizer.normalize("300000000000000", 0)).isEqualTo("2023-11-15 06:13:20");
    assertThat(normalizer.normalize("9999-12-31T23:00:00Z", 0)).isEqualTo("2023-11-15 06:13:20");
    assertThat(normalizer.normalize("9999-12-31 10:00:00", 8)).isEqualTo("9999-12-31 10:00:00");
  }
}
