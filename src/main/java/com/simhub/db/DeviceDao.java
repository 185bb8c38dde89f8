package com.simhub.db;

import com.simhub.model.Device;
import com.simhub.model.DeviceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DAO для таблицы devices.
 * <p>
 * Перед вставкой всегда проверяется существование строки по dev_id.
 */
public class DeviceDao {

  private static final Logger logger = LoggerFactory.getLogger(DeviceDao.class);

  private final Database database;

  public DeviceDao(Database database) {
    this.database = database;
  }

  public boolean exists(String devId) {
    return database.queryOne("SELECT id FROM devices WHERE dev_id = ?", devId) != null;
  }

  /**
   * Создаёт устройство в состоянии online (авторегистрация по первому сообщению).
   *
   * @param devId Аппаратный идентификатор шлюза.
   * @param now Каноническое текущее время.
   * @return true, если строка вставлена.
   */
  public boolean createDevice(String devId, String now) {
    String sql = "INSERT INTO devices (dev_id, status, last_seen_at, created_at, updated_at) VALUES (?, ?, ?, ?, ?)";
    return database.execute(sql, devId, DeviceStatus.ONLINE, now, now, now) > 0;
  }

  /**
   * Гарантирует, что устройство существует.
   *
   * @return true, если устройство есть после вызова.
   */
  public boolean ensureDevice(String devId, String now) {
    if (exists(devId)) {
      return true;
    }
    if (createDevice(devId, now)) {
      logger.info("🆕 Зарегистрировано новое устройство {}", devId);
      return true;
    }
    // вставку мог опередить параллельный запрос
    return exists(devId);
  }

  /**
   * Обновляет сетевое состояние устройства, создавая его при необходимости.
   *
   * @return true, если строка обновлена или создана.
   */
  public boolean upsertNetworkState(String devId, String ip, String ssid, int signalLevel,
                                    String hwVer, String now) {
    String update = """
        UPDATE devices
        SET last_ip = ?, last_ssid = ?, last_signal_level = ?, hw_ver = ?,
            status = ?, last_seen_at = ?, updated_at = ?
        WHERE dev_id = ?
        """;
    if (exists(devId)) {
      return database.execute(update, ip, ssid, signalLevel, hwVer, DeviceStatus.ONLINE, now, now, devId) > 0;
    }
    String insert = """
        INSERT INTO devices (dev_id, last_ip, last_ssid, last_signal_level, hw_ver,
                             status, last_seen_at, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    if (database.execute(insert, devId, ip, ssid, signalLevel, hwVer, DeviceStatus.ONLINE, now, now, now) > 0) {
      logger.info("🆕 Зарегистрировано новое устройство {}", devId);
      return true;
    }
    return database.execute(update, ip, ssid, signalLevel, hwVer, DeviceStatus.ONLINE, now, now, devId) > 0;
  }

  /**
   * Отмечает устройство как online и обновляет last_seen_at.
   */
  public boolean touch(String devId, String now) {
    String sql = "UPDATE devices SET status = ?, last_seen_at = ?, updated_at = ? WHERE dev_id = ?";
    return database.execute(sql, DeviceStatus.ONLINE, now, now, devId) > 0;
  }

  /**
   * Переводит в offline все online-устройства, не выходившие на связь с момента threshold.
   *
   * @param threshold Каноническое время отсечки.
   * @param now Каноническое текущее время для updated_at.
   * @return Количество переведённых устройств.
   */
  public int markOfflineBefore(String threshold, String now) {
    String sql = "UPDATE devices SET status = ?, updated_at = ? WHERE status = ? AND last_seen_at < ?";
    return database.execute(sql, DeviceStatus.OFFLINE, now, DeviceStatus.ONLINE, threshold);
  }

  public Device getDeviceById(String devId) {
    Map<String, Object> row = database.queryOne("SELECT * FROM devices WHERE dev_id = ?", devId);
    return row == null ? null : Device.fromRow(row);
  }

  public List<Device> getAllDevices() {
    List<Device> devices = new ArrayList<>();
    for (Map<String, Object> row : database.queryAll("SELECT * FROM devices ORDER BY dev_id")) {
      devices.add(Device.fromRow(row));
    }
    return devices;
  }

  public int countDevices(String devId) {
    Map<String, Object> row = database.queryOne("SELECT COUNT(*) AS cnt FROM devices WHERE dev_id = ?", devId);
    return row == null ? 0 : ((Number) row.get("cnt")).intValue();
  }

  /**
   * Задаёт операторскую метку устройства.
   */
  public boolean rename(String devId, String name, String now) {
    return database.execute("UPDATE devices SET name = ?, updated_at = ? WHERE dev_id = ?", name, now, devId) > 0;
  }

  /**
   * Удаляет устройство вместе со всеми дочерними строками.
   *
   * @return true, если устройство существовало и удалено.
   */
  public boolean deleteDevice(String devId) {
    database.execute("DELETE FROM sim_cards WHERE dev_id = ?", devId);
    database.execute("DELETE FROM messages WHERE dev_id = ?", devId);
    database.execute("DELETE FROM sms_records WHERE dev_id = ?", devId);
    database.execute("DELETE FROM call_records WHERE dev_id = ?", devId);
    boolean deleted = database.execute("DELETE FROM devices WHERE dev_id = ?", devId) > 0;
    if (deleted) {
      logger.info("🗑️ Устройство {} удалено вместе с дочерними записями", devId);
    }
    return deleted;
  }
}
