package com.simhub.model;

/**
 * Состояние SIM-карты в слоте.
 */
public final class SimStatus {

  public static final String UNKNOWN = "unknown";
  public static final String REGISTERING = "registering";
  public static final String READY = "ready";
  public static final String REMOVED = "removed";
  public static final String ERROR = "error";

  /**
   * Статус, который выставляет SIM-сообщение с данным кодом.
   *
   * @param type Код сообщения 202–209.
   * @return Статус SIM-карты; для неизвестных кодов {@link #UNKNOWN}.
   */
  public static String fromMessageType(int type) {
    switch (type) {
      case 202:
        return REGISTERING;
      case 203:
      case 204:
        return READY;
      case 205:
        return REMOVED;
      case 209:
        return ERROR;
      default:
        return UNKNOWN;
    }
  }

  private SimStatus() {
    throw new UnsupportedOperationException("Utility class");
  }
}
