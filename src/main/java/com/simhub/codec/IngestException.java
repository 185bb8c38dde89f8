package com.simhub.codec;

/**
 * Базовое исключение для ошибок приёма, которые отклоняют запрос шлюза (HTTP 400).
 */
public class IngestException extends RuntimeException {

  public IngestException(String message) {
    super(message);
  }

  public IngestException(String message, Throwable cause) {
    super(message, cause);
  }
}
