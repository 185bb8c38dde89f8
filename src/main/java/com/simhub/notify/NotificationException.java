package com.simhub.notify;

/**
 * Ошибка доставки уведомления в конкретный канал.
 */
public class NotificationException extends Exception {

  public NotificationException(String message) {
    super(message);
  }

  public NotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
