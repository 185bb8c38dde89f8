package com.simhub.codec;

/**
 * В событии нет обязательного devId или type не является целым числом.
 */
public class ValidationException extends IngestException {

  public ValidationException(String message) {
    super(message);
  }
}
