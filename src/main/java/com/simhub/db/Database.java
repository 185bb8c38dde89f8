package com.simhub.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Встроенная реляционная БД (H2 in-memory) со снимками на диск.
 * <p>
 * Жизненный цикл: {@link #open()} → запросы → {@link #close()}.
 * Все операции, включая запись снимка, выполняются под одной блокировкой,
 * поэтому обработчики запросов, sweeper и таймер снимков работают по одной дисциплине.
 * <p>
 * Политика надёжности: после каждого изменяющего запроса весь образ БД
 * записывается в файл снимка (сначала во временный файл, затем атомарная замена),
 * дополнительно снимок пишет {@link SnapshotScheduler}. Падение процесса между
 * изменением и записью снимка теряет не больше этого последнего изменения.
 * Ошибка записи снимка логируется и не
 * отменяет изменение: чтение всегда идёт из памяти.
 */
public class Database implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(Database.class);

  private static final String[] SCHEMA = {
      """
      CREATE TABLE IF NOT EXISTS devices (
          id BIGINT AUTO_INCREMENT PRIMARY KEY,
          dev_id VARCHAR(128) NOT NULL UNIQUE,
          name VARCHAR(255) DEFAULT '',
          hw_ver VARCHAR(64) DEFAULT '',
          last_ip VARCHAR(64) DEFAULT '',
          last_ssid VARCHAR(128) DEFAULT '',
          last_signal_level INTEGER DEFAULT 0,
          status VARCHAR(16) DEFAULT 'offline',
          last_seen_at VARCHAR(19),
          created_at VARCHAR(19),
          updated_at VARCHAR(19)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS sim_cards (
          id BIGINT AUTO_INCREMENT PRIMARY KEY,
          dev_id VARCHAR(128) NOT NULL,
          slot INTEGER NOT NULL,
          iccid VARCHAR(32) DEFAULT '',
          imsi VARCHAR(32) DEFAULT '',
          msisdn VARCHAR(32) DEFAULT '',
          operator_plmn VARCHAR(16) DEFAULT '',
          signal_level INTEGER DEFAULT 0,
          status VARCHAR(16) DEFAULT 'unknown',
          timezone_offset INTEGER,
          updated_at VARCHAR(19),
          CONSTRAINT uq_sim_cards_slot UNIQUE (dev_id, slot)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS messages (
          id BIGINT AUTO_INCREMENT PRIMARY KEY,
          dev_id VARCHAR(128) NOT NULL,
          type INTEGER NOT NULL,
          type_name VARCHAR(128) DEFAULT '',
          raw_data VARCHAR,
          created_at VARCHAR(19)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS sms_records (
          id BIGINT AUTO_INCREMENT PRIMARY KEY,
          dev_id VARCHAR(128) NOT NULL,
          slot INTEGER NOT NULL,
          phone_num VARCHAR(64) NOT NULL,
          content VARCHAR NOT NULL,
          sms_time VARCHAR(19),
          direction VARCHAR(8) DEFAULT 'in',
          created_at VARCHAR(19)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS call_records (
          id BIGINT AUTO_INCREMENT PRIMARY KEY,
          dev_id VARCHAR(128) NOT NULL,
          slot INTEGER NOT NULL,
          phone_num VARCHAR(64) NOT NULL,
          msg_type INTEGER NOT NULL,
          call_type VARCHAR(128) NOT NULL,
          start_time VARCHAR(19),
          duration_seconds BIGINT DEFAULT 0,
          created_at VARCHAR(19)
      )
      """,
      """
      CREATE TABLE IF NOT EXISTS push_config (
          id BIGINT AUTO_INCREMENT PRIMARY KEY,
          channel VARCHAR(32) NOT NULL UNIQUE,
          enabled BOOLEAN DEFAULT FALSE,
          config VARCHAR DEFAULT '{}',
          events VARCHAR DEFAULT '[]',
          updated_at VARCHAR(19)
      )
      """,
      "CREATE INDEX IF NOT EXISTS idx_messages_created ON messages(created_at)",
      "CREATE INDEX IF NOT EXISTS idx_sms_dev ON sms_records(dev_id)",
      "CREATE INDEX IF NOT EXISTS idx_calls_dev ON call_records(dev_id)"
  };

  /** Каналы, для которых при первом старте создаётся выключенная строка push_config. */
  static final String[] DEFAULT_CHANNELS = {"wecom", "feishu", "smtp"};

  private final Path snapshotPath;
  private final String url;
  private final ReentrantLock lock = new ReentrantLock();
  private Connection connection;

  /**
   * @param snapshotPath Файл снимка; загружается при открытии, если существует.
   */
  public Database(Path snapshotPath) {
    this.snapshotPath = snapshotPath;
    this.url = "jdbc:h2:mem:simhub-" + UUID.randomUUID();
  }

  /**
   * Открывает БД: восстанавливает снимок (если есть), создаёт недостающие таблицы
   * и строки каналов по умолчанию, сразу пишет свежий снимок.
   *
   * @throws IllegalStateException если снимок повреждён или БД недоступна.
   */
  public void open() {
    lock.lock();
    try {
      if (connection != null) {
        throw new IllegalStateException("База данных уже открыта");
      }
      connection = DriverManager.getConnection(url, "sa", "");
      if (Files.exists(snapshotPath)) {
        try (Statement stmt = connection.createStatement()) {
          stmt.execute("RUNSCRIPT FROM '" + quote(snapshotPath) + "'");
        }
        logger.info("✅ Снимок БД восстановлен из {}", snapshotPath);
      } else {
        logger.info("ℹ️ Снимок {} не найден, создаётся пустая БД", snapshotPath);
      }
      try (Statement stmt = connection.createStatement()) {
        for (String ddl : SCHEMA) {
          stmt.execute(ddl);
        }
      }
      seedChannels();
      writeSnapshot();
      logger.info("✅ База данных инициализирована");
    } catch (SQLException e) {
      closeQuietly();
      throw new IllegalStateException("Не удалось инициализировать базу данных из снимка " + snapshotPath, e);
    } finally {
      lock.unlock();
    }
  }

  private void seedChannels() throws SQLException {
    for (String channel : DEFAULT_CHANNELS) {
      boolean exists;
      try (PreparedStatement check = connection.prepareStatement("SELECT 1 FROM push_config WHERE channel = ?")) {
        check.setString(1, channel);
        try (ResultSet rs = check.executeQuery()) {
          exists = rs.next();
        }
      }
      if (!exists) {
        try (PreparedStatement insert = connection.prepareStatement(
            "INSERT INTO push_config (channel, enabled, config, events) VALUES (?, FALSE, '{}', '[]')")) {
          insert.setString(1, channel);
          insert.executeUpdate();
        }
        logger.info("Инициализирован канал уведомлений: {}", channel);
      }
    }
  }

  /**
   * Выполняет изменяющий запрос и, если строки изменились, сохраняет снимок.
   *
   * @param sql Параметризованный SQL.
   * @param params Значения параметров по порядку.
   * @return Количество изменённых строк; 0 при ошибке БД (ошибка логируется).
   */
  public int execute(String sql, Object... params) {
    lock.lock();
    try {
      int changes;
      try (PreparedStatement pstmt = requireOpen().prepareStatement(sql)) {
        bind(pstmt, params);
        changes = pstmt.executeUpdate();
      } catch (SQLException e) {
        logger.error("❌ Ошибка выполнения SQL: {} | параметры: {}", compact(sql), List.of(printable(params)), e);
        return 0;
      }
      if (changes > 0) {
        logger.debug("SQL: {} | изменено строк: {}", compact(sql), changes);
        writeSnapshot();
      }
      return changes;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return Первая строка результата или {@code null}, если строк нет или запрос упал.
   */
  public Map<String, Object> queryOne(String sql, Object... params) {
    List<Map<String, Object>> rows = queryAll(sql, params);
    return rows.isEmpty() ? null : rows.get(0);
  }

  /**
   * Выполняет SELECT.
   *
   * @return Строки результата; ключи: имена колонок в нижнем регистре.
   *     При ошибке БД пустой список.
   */
  public List<Map<String, Object>> queryAll(String sql, Object... params) {
    lock.lock();
    try (PreparedStatement pstmt = requireOpen().prepareStatement(sql)) {
      bind(pstmt, params);
      try (ResultSet rs = pstmt.executeQuery()) {
        ResultSetMetaData meta = rs.getMetaData();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
          }
          rows.add(row);
        }
        return rows;
      }
    } catch (SQLException e) {
      logger.error("❌ Ошибка чтения: {} | параметры: {}", compact(sql), List.of(printable(params)), e);
      return new ArrayList<>();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Принудительно пишет снимок (используется таймером и при закрытии).
   *
   * @return true, если снимок записан.
   */
  public boolean snapshot() {
    lock.lock();
    try {
      if (connection == null) {
        return false;
      }
      return writeSnapshot();
    } finally {
      lock.unlock();
    }
  }

  public Path getSnapshotPath() {
    return snapshotPath;
  }

  /**
   * Пишет финальный снимок и закрывает соединение; in-memory БД при этом удаляется.
   */
  @Override
  public void close() {
    lock.lock();
    try {
      if (connection == null) {
        return;
      }
      writeSnapshot();
      closeQuietly();
      logger.info("База данных закрыта");
    } finally {
      lock.unlock();
    }
  }

  private boolean writeSnapshot() {
    Path tmp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
    try {
      Path parent = snapshotPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Statement stmt = connection.createStatement()) {
        stmt.execute("SCRIPT TO '" + quote(tmp) + "'");
      }
      try {
        Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
      }
      return true;
    } catch (SQLException | IOException e) {
      logger.error("❌ Не удалось сохранить снимок БД в {}", snapshotPath, e);
      return false;
    }
  }

  private Connection requireOpen() throws SQLException {
    if (connection == null) {
      throw new SQLException("База данных не открыта");
    }
    return connection;
  }

  private void closeQuietly() {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      logger.warn("Ошибка при закрытии соединения с БД", e);
    }
    connection = null;
  }

  private static void bind(PreparedStatement pstmt, Object[] params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      pstmt.setObject(i + 1, params[i]);
    }
  }

  private static String quote(Path path) {
    return path.toAbsolutePath().toString().replace("'", "''");
  }

  private static String compact(String sql) {
    String oneLine = sql.replaceAll("\\s+", " ").trim();
    return oneLine.length() > 80 ? oneLine.substring(0, 80) + "..." : oneLine;
  }

  private static Object[] printable(Object[] params) {
    Object[] copy = new Object[params.length];
    for (int i = 0; i < params.length; i++) {
      copy[i] = String.valueOf(params[i]);
    }
    return copy;
  }
}
