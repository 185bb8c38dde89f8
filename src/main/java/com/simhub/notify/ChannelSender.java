package com.simhub.notify;

import com.simhub.model.ChannelConfig;

/**
 * Адаптер доставки в один тип канала (чат-webhook, почта).
 */
public interface ChannelSender {

  /**
   * @return Имя канала, совпадающее с push_config.channel.
   */
  String channel();

  /**
   * Доставляет сообщение. Реализация обязана ограничивать ожидание таймаутом.
   *
   * @param config Настройки канала.
   * @param message Отформатированное сообщение.
   * @throws NotificationException если доставка не удалась или канал не настроен.
   */
  void send(ChannelConfig config, NotificationMessage message) throws NotificationException;
}
