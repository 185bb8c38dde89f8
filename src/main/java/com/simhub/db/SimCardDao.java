package com.simhub.db;

import com.simhub.model.SimCard;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DAO для таблицы sim_cards.
 * <p>
 * Обновление сливает поля: пустая строка или {@code null} в новом сообщении
 * не затирает уже известное значение.
 */
public class SimCardDao {

  private final Database database;

  public SimCardDao(Database database) {
    this.database = database;
  }

  /**
   * Создаёт или дополняет SIM-карту в слоте.
   *
   * @param signalLevel Уровень сигнала или {@code null}, если не передан.
   * @return true, если строка создана или обновлена.
   */
  public boolean upsertSimCard(String devId, int slot, String iccid, String imsi, String msisdn,
                               Integer signalLevel, String plmn, String status, String now) {
    String update = """
        UPDATE sim_cards
        SET iccid = COALESCE(NULLIF(CAST(? AS VARCHAR), ''), iccid),
            imsi = COALESCE(NULLIF(CAST(? AS VARCHAR), ''), imsi),
            msisdn = COALESCE(NULLIF(CAST(? AS VARCHAR), ''), msisdn),
            signal_level = COALESCE(CAST(? AS INTEGER), signal_level),
            operator_plmn = COALESCE(NULLIF(CAST(? AS VARCHAR), ''), operator_plmn),
            status = ?,
            updated_at = ?
        WHERE dev_id = ? AND slot = ?
        """;
    Object[] updateParams = {
        blank(iccid), blank(imsi), blank(msisdn), signalLevel, blank(plmn), status, now, devId, slot
    };
    if (getSimCard(devId, slot) != null) {
      return database.execute(update, updateParams) > 0;
    }
    String insert = """
        INSERT INTO sim_cards (dev_id, slot, iccid, imsi, msisdn, signal_level, operator_plmn, status, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    int inserted = database.execute(insert, devId, slot, blank(iccid), blank(imsi), blank(msisdn),
        signalLevel == null ? 0 : signalLevel, blank(plmn), status, now);
    if (inserted > 0) {
      return true;
    }
    return database.execute(update, updateParams) > 0;
  }

  public SimCard getSimCard(String devId, int slot) {
    Map<String, Object> row = database.queryOne("SELECT * FROM sim_cards WHERE dev_id = ? AND slot = ?", devId, slot);
    return row == null ? null : SimCard.fromRow(row);
  }

  public List<SimCard> getSimCards(String devId) {
    List<SimCard> cards = new ArrayList<>();
    for (Map<String, Object> row : database.queryAll("SELECT * FROM sim_cards WHERE dev_id = ? ORDER BY slot", devId)) {
      cards.add(SimCard.fromRow(row));
    }
    return cards;
  }

  /**
   * Задаёт часовой пояс оператора для слота.
   *
   * @param offsetHours Смещение в часах к востоку от UTC; {@code null} сбрасывает настройку.
   * @return false, если слот ещё не появлялся в сообщениях устройства.
   */
  public boolean updateTimezone(String devId, int slot, Integer offsetHours, String now) {
    String sql = "UPDATE sim_cards SET timezone_offset = CAST(? AS INTEGER), updated_at = ? WHERE dev_id = ? AND slot = ?";
    return database.execute(sql, offsetHours, now, devId, slot) > 0;
  }

  /**
   * Ищет часовой пояс SIM-карты для пересчёта времени SMS и звонков.
   * <p>
   * Порядок: точное совпадение (devId, slot) → совпадение (devId, imsi) →
   * любая SIM-карта устройства с заданным поясом → 0 (UTC).
   * На каждом шаге учитываются только строки с заданным поясом.
   */
  public int findTimezoneOffset(String devId, Integer slot, String imsi) {
    if (slot != null) {
      Integer offset = offsetOf(database.queryOne(
          "SELECT timezone_offset FROM sim_cards WHERE dev_id = ? AND slot = ? AND timezone_offset IS NOT NULL",
          devId, slot));
      if (offset != null) {
        return offset;
      }
    }
    if (imsi != null && !imsi.isEmpty()) {
      Integer offset = offsetOf(database.queryOne(
          "SELECT timezone_offset FROM sim_cards WHERE dev_id = ? AND imsi = ? AND timezone_offset IS NOT NULL",
          devId, imsi));
      if (offset != null) {
        return offset;
      }
    }
    Integer offset = offsetOf(database.queryOne(
        "SELECT timezone_offset FROM sim_cards WHERE dev_id = ? AND timezone_offset IS NOT NULL ORDER BY slot LIMIT 1",
        devId));
    return offset != null ? offset : 0;
  }

  private static Integer offsetOf(Map<String, Object> row) {
    if (row == null) {
      return null;
    }
    Object value = row.get("timezone_offset");
    return value instanceof Number ? ((Number) value).intValue() : null;
  }

  private static String blank(String value) {
    return value == null ? "" : value;
  }
}
