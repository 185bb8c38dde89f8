package com.simhub.notify;

import java.util.Map;

/**
 * Точка передачи доменных событий в каналы уведомлений.
 * <p>
 * Вызов не блокирует вызывающего на доставке и никогда не бросает исключений
 * из-за проблем каналов.
 */
public interface NotificationService {

  String DEVICE_STATUS = "device_status";
  String SIM = "sim";
  String SMS = "sms";
  String CALL = "call";
  String SYSTEM = "system";

  /**
   * Ставит событие в очередь на рассылку.
   *
   * @param event Категория события (см. константы интерфейса).
   * @param data Данные для форматирования сообщения.
   */
  void publish(String event, Map<String, Object> data);
}
