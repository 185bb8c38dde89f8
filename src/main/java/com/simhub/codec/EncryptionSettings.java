package com.simhub.codec;

import com.simhub.config.AppSettings;

import java.nio.charset.StandardCharsets;

/**
 * Параметры AES-шифрования, которое шлюз применяет к push-сообщениям.
 * <p>
 * KEY и IV задаются в одном из трёх текстовых форматов:
 * <ul>
 *   <li>ASCII-строка: {@code 1234567890123456}</li>
 *   <li>десятичные байты: {@code 49,50,51,...}</li>
 *   <li>шестнадцатеричные байты: {@code 0x31,0x32,0x33,...}</li>
 * </ul>
 * В каждом случае должно получиться ровно 16 байт.
 */
public final class EncryptionSettings {

  private static final int BLOCK_BYTES = 16;

  private final boolean enabled;
  private final byte[] key;
  private final byte[] iv;

  private EncryptionSettings(boolean enabled, byte[] key, byte[] iv) {
    this.enabled = enabled;
    this.key = key;
    this.iv = iv;
  }

  public static EncryptionSettings disabled() {
    return new EncryptionSettings(false, null, null);
  }

  /**
   * @param key KEY в одном из поддерживаемых форматов.
   * @param iv IV в одном из поддерживаемых форматов.
   * @throws IllegalArgumentException если KEY или IV не дают 16 байт.
   */
  public static EncryptionSettings enabled(String key, String iv) {
    return new EncryptionSettings(true, parseKeyOrIv(key), parseKeyOrIv(iv));
  }

  public static EncryptionSettings from(AppSettings settings) {
    if (!settings.isAesEnabled()) {
      return disabled();
    }
    return enabled(settings.getAesKey(), settings.getAesIv());
  }

  public boolean isEnabled() {
    return enabled;
  }

  byte[] key() {
    return key.clone();
  }

  byte[] iv() {
    return iv.clone();
  }

  static byte[] parseKeyOrIv(String input) {
    if (input == null || input.isEmpty()) {
      throw new IllegalArgumentException("AES KEY/IV не может быть пустым");
    }
    if (input.contains(",")) {
      String[] parts = input.split(",");
      if (parts.length != BLOCK_BYTES) {
        throw new IllegalArgumentException("AES KEY/IV должен содержать 16 байт, получено: " + parts.length);
      }
      byte[] bytes = new byte[BLOCK_BYTES];
      for (int i = 0; i < parts.length; i++) {
        String part = parts[i].trim();
        int value;
        try {
          if (part.startsWith("0x") || part.startsWith("0X")) {
            value = Integer.parseInt(part.substring(2), 16);
          } else {
            value = Integer.parseInt(part, 10);
          }
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Некорректный байт AES KEY/IV: '" + part + "'", e);
        }
        if (value < 0 || value > 255) {
          throw new IllegalArgumentException("Байт AES KEY/IV вне диапазона 0..255: " + value);
        }
        bytes[i] = (byte) value;
      }
      return bytes;
    }
    byte[] ascii = input.getBytes(StandardCharsets.UTF_8);
    if (ascii.length != BLOCK_BYTES) {
      throw new IllegalArgumentException("AES KEY/IV должен быть длиной 16 байт, получено: " + ascii.length);
    }
    return ascii;
  }
}
