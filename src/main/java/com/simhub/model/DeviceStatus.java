package com.simhub.model;

/**
 * Сетевое состояние шлюза.
 */
public final class DeviceStatus {

  public static final String ONLINE = "online";
  public static final String OFFLINE = "offline";

  private DeviceStatus() {
    throw new UnsupportedOperationException("Utility class");
  }
}
