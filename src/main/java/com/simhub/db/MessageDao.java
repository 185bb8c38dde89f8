package com.simhub.db;

import java.util.List;
import java.util.Map;

/**
 * DAO для журнала сырых сообщений (таблица messages).
 */
public class MessageDao {

  private final Database database;

  public MessageDao(Database database) {
    this.database = database;
  }

  /**
   * Сохраняет входящее сообщение как есть.
   *
   * @param rawData Исходное событие, сериализованное в JSON.
   * @return true, если строка вставлена.
   */
  public boolean saveMessage(String devId, int type, String typeName, String rawData, String now) {
    String sql = "INSERT INTO messages (dev_id, type, type_name, raw_data, created_at) VALUES (?, ?, ?, ?, ?)";
    return database.execute(sql, devId, type, typeName, rawData, now) > 0;
  }

  public List<Map<String, Object>> getMessages(String devId) {
    return database.queryAll(
        "SELECT dev_id, type, type_name, raw_data, created_at FROM messages WHERE dev_id = ? ORDER BY id", devId);
  }

  /**
   * Удаляет записи журнала старше отсечки.
   *
   * @param threshold Каноническое время отсечки.
   * @return Количество удалённых строк.
   */
  public int deleteOlderThan(String threshold) {
    return database.execute("DELETE FROM messages WHERE created_at < ?", threshold);
  }
}
