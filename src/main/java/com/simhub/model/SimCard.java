package com.simhub.model;

import java.util.Map;

/**
 * Строка таблицы sim_cards: SIM-карта в конкретном слоте шлюза.
 * Уникальна по паре (devId, slot).
 */
public class SimCard {

  private String devId;
  private int slot;
  private String iccid;
  private String imsi;
  private String msisdn;
  private String operatorPlmn;
  private int signalLevel;
  private String status;
  private Integer timezoneOffsetHours;
  private String updatedAt;

  public SimCard() {}

  public static SimCard fromRow(Map<String, Object> row) {
    SimCard sim = new SimCard();
    sim.setDevId(Rows.string(row, "dev_id"));
    sim.setSlot(Rows.integer(row, "slot", 0));
    sim.setIccid(Rows.string(row, "iccid"));
    sim.setImsi(Rows.string(row, "imsi"));
    sim.setMsisdn(Rows.string(row, "msisdn"));
    sim.setOperatorPlmn(Rows.string(row, "operator_plmn"));
    sim.setSignalLevel(Rows.integer(row, "signal_level", 0));
    sim.setStatus(Rows.string(row, "status"));
    sim.setTimezoneOffsetHours(Rows.nullableInteger(row, "timezone_offset"));
    sim.setUpdatedAt(Rows.string(row, "updated_at"));
    return sim;
  }

  public String getDevId() {
    return devId;
  }

  public void setDevId(String devId) {
    this.devId = devId;
  }

  public int getSlot() {
    return slot;
  }

  public void setSlot(int slot) {
    this.slot = slot;
  }

  public String getIccid() {
    return iccid;
  }

  public void setIccid(String iccid) {
    this.iccid = iccid;
  }

  public String getImsi() {
    return imsi;
  }

  public void setImsi(String imsi) {
    this.imsi = imsi;
  }

  public String getMsisdn() {
    return msisdn;
  }

  public void setMsisdn(String msisdn) {
    this.msisdn = msisdn;
  }

  public String getOperatorPlmn() {
    return operatorPlmn;
  }

  public void setOperatorPlmn(String operatorPlmn) {
    this.operatorPlmn = operatorPlmn;
  }

  public int getSignalLevel() {
    return signalLevel;
  }

  public void setSignalLevel(int signalLevel) {
    this.signalLevel = signalLevel;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  /**
   * @return Часовой пояс оператора (часы к востоку от UTC) или {@code null}, если не задан.
   */
  public Integer getTimezoneOffsetHours() {
    return timezoneOffsetHours;
  }

  public void setTimezoneOffsetHours(Integer timezoneOffsetHours) {
    this.timezoneOffsetHours = timezoneOffsetHours;
  }

  public String getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(String updatedAt) {
    this.updatedAt = updatedAt;
  }
}
