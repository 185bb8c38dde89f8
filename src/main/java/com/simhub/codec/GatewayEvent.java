package com.simhub.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Нормализованное событие от шлюза: плоский набор полей с обязательными
 * {@code devId} и {@code type}.
 * <p>
 * Остальные поля зависят от категории сообщения и могут отсутствовать.
 * Прошивки шлюзов называют одно и то же поле по-разному, поэтому методы
 * чтения принимают список ключей-синонимов и берут первый непустой.
 */
public final class GatewayEvent {

  private final String devId;
  private final int type;
  private final Map<String, Object> fields;

  public GatewayEvent(String devId, int type, Map<String, Object> fields) {
    this.devId = devId;
    this.type = type;
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public String getDevId() {
    return devId;
  }

  public int getType() {
    return type;
  }

  /**
   * @return Все поля события в исходном порядке, включая devId и type.
   */
  public Map<String, Object> getFields() {
    return fields;
  }

  /**
   * Возвращает первое непустое значение среди ключей-синонимов.
   *
   * @param keys Ключи в порядке приоритета.
   * @return Строковое значение или {@code null}, если ни одного нет.
   */
  public String getString(List<String> keys) {
    for (String key : keys) {
      Object value = fields.get(key);
      if (value != null) {
        String text = value.toString().trim();
        if (!text.isEmpty()) {
          return text;
        }
      }
    }
    return null;
  }

  public String getString(String key) {
    return getString(List.of(key));
  }

  /**
   * Первое значение среди синонимов, приводимое к целому числу.
   *
   * @param keys Ключи в порядке приоритета.
   * @return Число или {@code null}.
   */
  public Long getLong(List<String> keys) {
    for (String key : keys) {
      Long value = toLong(fields.get(key));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  public Integer getInteger(String key) {
    Long value = getLong(List.of(key));
    if (value == null || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      return null;
    }
    return value.intValue();
  }

  /**
   * Сырое значение поля (число, строка или вложенная структура из JSON).
   */
  public Object get(List<String> keys) {
    for (String key : keys) {
      Object value = fields.get(key);
      if (value != null && !value.toString().trim().isEmpty()) {
        return value;
      }
    }
    return null;
  }

  static Long toLong(Object value) {
    if (value instanceof BigInteger || value instanceof BigDecimal) {
      try {
        return value instanceof BigInteger
            ? ((BigInteger) value).longValueExact()
            : ((BigDecimal) value).longValueExact();
      } catch (ArithmeticException e) {
        // не помещается в long или дробное
        return null;
      }
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      if (text.matches("-?\\d{1,18}")) {
        return Long.parseLong(text);
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "GatewayEvent{devId='" + devId + "', type=" + type + ", fields=" + fields + '}';
  }
}
