package com.simhub.event;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Статическая таблица кодов сообщений шлюза.
 * <p>
 * Диапазоны: 100–102 подключение к сети, 202–209 SIM-карта, 301 модем,
 * 401–402 ответы на команды, 501–502 SMS, 601–642 звонки,
 * 681–689 ответы на управление звонком, 998 служебные.
 */
public final class EventClassifier {

  private static final Map<Integer, EventType> TYPES = new LinkedHashMap<>();

  static {
    register(100, EventCategory.NETWORK, "WiFi connected");
    register(101, EventCategory.NETWORK, "SIM slot 1 connected");
    register(102, EventCategory.NETWORK, "SIM slot 2 connected");

    register(202, EventCategory.SIM, "SIM registering on network");
    register(203, EventCategory.SIM, "SIM identity acquired");
    register(204, EventCategory.SIM, "SIM ready");
    register(205, EventCategory.SIM, "SIM removed");
    register(209, EventCategory.SIM, "SIM error");

    register(301, EventCategory.MODULE, "Cellular module error");

    register(401, EventCategory.COMMAND, "Command received");
    register(402, EventCategory.COMMAND, "Command processed");

    register(501, EventCategory.SMS, "New SMS");
    register(502, EventCategory.SMS, "SMS sent");

    register(601, EventCategory.CALL, "Incoming call ringing");
    register(602, EventCategory.CALL, "Incoming call answered");
    register(603, EventCategory.CALL, "Incoming call hung up by caller");
    register(620, EventCategory.CALL, "Outgoing call dialing");
    register(621, EventCategory.CALL, "Outgoing call ringing");
    register(622, EventCategory.CALL, "Outgoing call connected");
    register(623, EventCategory.CALL, "Outgoing call hung up");
    register(641, EventCategory.CALL, "Local key press during call");
    register(642, EventCategory.CALL, "Remote key press during call");

    register(681, EventCategory.CALL_CONTROL, "Dial succeeded");
    register(682, EventCategory.CALL_CONTROL, "Dial failed");
    register(684, EventCategory.CALL_CONTROL, "Answer succeeded");
    register(685, EventCategory.CALL_CONTROL, "Answer failed");
    register(687, EventCategory.CALL_CONTROL, "TTS playback succeeded");
    register(688, EventCategory.CALL_CONTROL, "TTS playback failed");
    register(689, EventCategory.CALL_CONTROL, "TTS playback finished");

    register(998, EventCategory.SYSTEM, "Heartbeat PING");
  }

  private static void register(int code, EventCategory category, String label) {
    TYPES.put(code, new EventType(code, category, label));
  }

  /**
   * Классифицирует код сообщения. Никогда не бросает исключений.
   *
   * @param code Числовой код из поля type.
   * @return Тип из таблицы или {@code unknown message(<code>)} с категорией UNKNOWN.
   */
  public static EventType classify(int code) {
    EventType type = TYPES.get(code);
    if (type != null) {
      return type;
    }
    return new EventType(code, EventCategory.UNKNOWN, "unknown message(" + code + ")");
  }

  /**
   * @return Все известные типы в порядке возрастания кода.
   */
  public static Collection<EventType> knownTypes() {
    return Collections.unmodifiableCollection(TYPES.values());
  }

  private EventClassifier() {
    throw new UnsupportedOperationException("Utility class");
  }
}
