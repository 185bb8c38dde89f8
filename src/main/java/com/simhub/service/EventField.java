package com.simhub.service;

import java.util.List;

/**
 * Логические поля сообщений и их синонимы в разных версиях прошивки.
 * Значение берётся по первому присутствующему непустому ключу.
 */
public enum EventField {
  PHONE("phNum", "phoneNum", "phone", "msIsdn"),
  SMS_CONTENT("smsBd", "content", "sms"),
  SMS_TIME("smsTs", "time"),
  CALL_START("telStartTs", "time"),
  CALL_END("telEndTs"),
  ICCID("iccId", "iccid"),
  IMSI("imsi"),
  MSISDN("msIsdn", "msisdn"),
  SIGNAL("dbm", "signal"),
  PLMN("plmn", "operator"),
  IP("ip"),
  SSID("ssid"),
  HW_VER("hwVer");

  private final List<String> keys;

  EventField(String... keys) {
    this.keys = List.of(keys);
  }

  public List<String> keys() {
    return keys;
  }
}
