package com.simhub.model;

import java.util.Map;

/**
 * Чтение значений из строки результата, возвращённой {@code Database}.
 */
final class Rows {

  static String string(Map<String, Object> row, String column) {
    Object value = row.get(column);
    return value == null ? null : value.toString();
  }

  static int integer(Map<String, Object> row, String column, int defaultValue) {
    Object value = row.get(column);
    return value instanceof Number ? ((Number) value).intValue() : defaultValue;
  }

  static Integer nullableInteger(Map<String, Object> row, String column) {
    Object value = row.get(column);
    return value instanceof Number ? ((Number) value).intValue() : null;
  }

  private Rows() {
    throw new UnsupportedOperationException("Utility class");
  }
}
