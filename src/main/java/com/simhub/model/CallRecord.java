package com.simhub.model;

import java.util.Map;

/**
 * Запись журнала звонков (только добавление).
 */
public class CallRecord {

  private final String devId;
  private final int slot;
  private final String phoneNum;
  private final int msgType;
  private final String callType;
  private final String startTime;
  private final long durationSeconds;
  private final String createdAt;

  public CallRecord(String devId, int slot, String phoneNum, int msgType, String callType,
                    String startTime, long durationSeconds, String createdAt) {
    this.devId = devId;
    this.slot = slot;
    this.phoneNum = phoneNum;
    this.msgType = msgType;
    this.callType = callType;
    this.startTime = startTime;
    this.durationSeconds = durationSeconds;
    this.createdAt = createdAt;
  }

  public static CallRecord fromRow(Map<String, Object> row) {
    Object duration = row.get("duration_seconds");
    return new CallRecord(
        Rows.string(row, "dev_id"),
        Rows.integer(row, "slot", 0),
        Rows.string(row, "phone_num"),
        Rows.integer(row, "msg_type", 0),
        Rows.string(row, "call_type"),
        Rows.string(row, "start_time"),
        duration instanceof Number ? ((Number) duration).longValue() : 0L,
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

  /**
   * @return Исходный код сообщения (601, 603, ...).
   */
  public int getMsgType() {
    return msgType;
  }

  /**
   * @return Метка кода сообщения из классификатора.
   */
  public String getCallType() {
    return callType;
  }

  public String getStartTime() {
    return startTime;
  }

  public long getDurationSeconds() {
    return durationSeconds;
  }

  public String getCreatedAt() {
    return createdAt;
  }
}
