package com.simhub.event;

/**
 * Грубая категория сообщения шлюза, определяемая по числовому коду.
 */
public enum EventCategory {
  NETWORK("network"),
  SIM("sim"),
  MODULE("module"),
  COMMAND("command"),
  SMS("sms"),
  CALL("call"),
  CALL_CONTROL("call_control"),
  SYSTEM("system"),
  UNKNOWN("unknown");

  private final String wireName;

  EventCategory(String wireName) {
    this.wireName = wireName;
  }

  /**
   * @return Имя категории в том виде, в каком оно хранится и отображается.
   */
  public String wireName() {
    return wireName;
  }
}
