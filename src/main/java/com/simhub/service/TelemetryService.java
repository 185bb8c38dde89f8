package com.simhub.service;

import com.simhub.codec.GatewayEvent;

/**
 * Сервис для обработки сообщений от шлюзов.
 * <p>
 * Отвечает за сохранение состояния устройств и SIM-карт, ведение журналов
 * и постановку уведомлений в очередь.
 */
public interface TelemetryService {

  /**
   * Обрабатывает входящее сообщение: пишет журнал, обновляет состояние,
   * ставит уведомление в очередь.
   *
   * @param event Декодированное событие шлюза.
   * @return true, если запись состояния в хранилище прошла успешно
   *     (в том числе для неизвестных кодов); результат уведомлений не учитывается.
   * @throws IllegalArgumentException если event равен null.
   */
  boolean processTelemetry(GatewayEvent event);
}
