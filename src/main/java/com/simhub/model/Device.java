package com.simhub.model;

import java.util.Map;

/**
 * Строка таблицы devices: один физический шлюз.
 */
public class Device {

  private String devId;
  private String name;
  private String hwVer;
  private String lastIp;
  private String lastSsid;
  private int lastSignalLevel;
  private String status;
  private String lastSeenAt;
  private String createdAt;
  private String updatedAt;

  public Device() {}

  /**
   * Собирает объект из строки результата запроса.
   *
   * @param row Колонки в нижнем регистре.
   * @return Устройство.
   */
  public static Device fromRow(Map<String, Object> row) {
    Device device = new Device();
    device.setDevId(Rows.string(row, "dev_id"));
    device.setName(Rows.string(row, "name"));
    device.setHwVer(Rows.string(row, "hw_ver"));
    device.setLastIp(Rows.string(row, "last_ip"));
    device.setLastSsid(Rows.string(row, "last_ssid"));
    device.setLastSignalLevel(Rows.integer(row, "last_signal_level", 0));
    device.setStatus(Rows.string(row, "status"));
    device.setLastSeenAt(Rows.string(row, "last_seen_at"));
    device.setCreatedAt(Rows.string(row, "created_at"));
    device.setUpdatedAt(Rows.string(row, "updated_at"));
    return device;
  }

  public String getDevId() {
    return devId;
  }

  public void setDevId(String devId) {
    this.devId = devId;
  }

  /**
   * @return Метка, заданная оператором в админке.
   */
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getHwVer() {
    return hwVer;
  }

  public void setHwVer(String hwVer) {
    this.hwVer = hwVer;
  }

  public String getLastIp() {
    return lastIp;
  }

  public void setLastIp(String lastIp) {
    this.lastIp = lastIp;
  }

  public String getLastSsid() {
    return lastSsid;
  }

  public void setLastSsid(String lastSsid) {
    this.lastSsid = lastSsid;
  }

  /**
   * @return Уровень сигнала в dBm из последнего сетевого сообщения.
   */
  public int getLastSignalLevel() {
    return lastSignalLevel;
  }

  public void setLastSignalLevel(int lastSignalLevel) {
    this.lastSignalLevel = lastSignalLevel;
  }

  /**
   * @return {@link DeviceStatus#ONLINE} или {@link DeviceStatus#OFFLINE}.
   */
  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public String getLastSeenAt() {
    return lastSeenAt;
  }

  public void setLastSeenAt(String lastSeenAt) {
    this.lastSeenAt = lastSeenAt;
  }

  public String getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(String createdAt) {
    this.createdAt = createdAt;
  }

  public String getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(String updatedAt) {
    this.updatedAt = updatedAt;
  }
}
