package com.simhub.codec;

/**
 * Не удалось расшифровать payload. Для режима "всё сообщение в поле p" это
 * жёсткая ошибка запроса; в пофилдовом режиме наружу не выходит.
 */
public class DecryptionException extends IngestException {

  public DecryptionException(String message) {
    super(message);
  }

  public DecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
