package com.simhub.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Утилитарный класс для загрузки конфигурации из application.properties.
 * <p>
 * Все параметры читаются из classpath-файла "application.properties".
 * Любой параметр можно переопределить системным свойством JVM с тем же ключом
 * (например, {@code -Daes.enabled=true}).
 */
public final class Config {

  private static final Properties PROPS = new Properties();

  static {
    try (InputStream input = Config.class.getClassLoader()
        .getResourceAsStream("application.properties")) {
      if (input == null) {
        throw new IllegalStateException("Файл application.properties не найден в classpath.");
      }
      PROPS.load(input);
    } catch (IOException e) {
      throw new IllegalStateException("Не удалось загрузить application.properties", e);
    }
  }

  /**
   * Возвращает значение обязательного параметра по ключу.
   * <p>
   * Если параметр отсутствует или пуст — бросает исключение.
   *
   * @param key Ключ параметра (например, "db.snapshot.path").
   * @return Непустое строковое значение.
   * @throws IllegalStateException если параметр не задан или пуст.
   */
  public static String getRequiredProperty(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new IllegalStateException("Обязательный параметр '" + key + "' не задан ни в системных свойствах, ни в application.properties");
    }
    return value;
  }

  /**
   * Возвращает значение параметра или значение по умолчанию.
   *
   * @param key Ключ параметра.
   * @param defaultValue Значение, если параметр не задан или пуст.
   * @return Строковое значение.
   */
  public static String getProperty(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  public static int getIntProperty(String key, int defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть целым числом, получено: " + value, e);
    }
  }

  public static boolean getBooleanProperty(String key, boolean defaultValue) {
    String value = lookup(key);
    return value != null ? Boolean.parseBoolean(value) : defaultValue;
  }

  private static String lookup(String key) {
    // Сначала пробуем системное свойство
    String sysValue = System.getProperty(key);
    if (sysValue != null && !sysValue.trim().isEmpty()) {
      return sysValue.trim();
    }
    String propValue = PROPS.getProperty(key);
    if (propValue == null || propValue.trim().isEmpty()) {
      return null;
    }
    return propValue.trim();
  }

  // Запрещаем создание экземпляров
  private Config() {
    throw new UnsupportedOperationException("Utility class");
  }
}
