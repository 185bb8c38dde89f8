package com.simhub.model;

import java.util.Map;

/**
 * Запись журнала SMS (только добавление).
 */
public class SmsRecord {

  public static final String DIRECTION_IN = "in";
  public static final String DIRECTION_OUT = "out";

  private final String devId;
  private final int slot;
  private final String phoneNum;
  private final String content;
  private final String smsTime;
  private final String direction;
  private final String createdAt;

  public SmsRecord(String devId, int slot, String phoneNum, String content,
                   String smsTime, String direction, String createdAt) {
    this.devId = devId;
    this.slot = slot;
    this.phoneNum = phoneNum;
    this.content = content;
    this.smsTime = smsTime;
    this.direction = direction;
    this.createdAt = createdAt;
  }

  public static SmsRecord fromRow(Map<String, Object> row) {
    return new SmsRecord(
        Rows.string(row, "dev_id"),
        Rows.integer(row, "slot", 0),
        Rows.string(row, "phone_num"),
        Rows.string(row, "content"),
        Rows.string(row, "sms_time"),
        Rows.string(row, "direction"),
        Rows.string(row, "created_at"));
  }

  public String getDevId() {
    return devId;
  }

  public int getSlot() {
    return slot;
  }

  public String getPhoneNum() {
    return phoneNum;
  }

  public String getContent() {
    return content;
  }

  /**
   * @return Время SMS в каноническом формате (UTC+8).
   */
  public String getSmsTime() {
    return smsTime;
  }

  public String getDirection() {
    return direction;
  }

  public String getCreatedAt() {
    return createdAt;
  }
}
