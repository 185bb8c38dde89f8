package com.simhub.codec;

/**
 * Тело запроса не удалось разобрать (например, невалидный JSON).
 */
public class DecodeException extends IngestException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
