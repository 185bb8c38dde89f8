package com.simhub.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simhub.model.ChannelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DAO для настроек каналов уведомлений (таблица push_config).
 * <p>
 * Колонки config и events хранят JSON-объект и JSON-массив соответственно.
 */
public class ChannelConfigDao {

  private static final Logger logger = LoggerFactory.getLogger(ChannelConfigDao.class);

  private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_TYPE = new TypeReference<>() {};
  private static final TypeReference<LinkedHashSet<String>> EVENTS_TYPE = new TypeReference<>() {};

  private final Database database;
  private final ObjectMapper objectMapper;

  public ChannelConfigDao(Database database, ObjectMapper objectMapper) {
    this.database = database;
    this.objectMapper = objectMapper;
  }

  /**
   * @return Настройки всех каналов; строка с испорченным JSON пропускается с ошибкой в логе.
   */
  public List<ChannelConfig> getAllConfigs() {
    List<ChannelConfig> configs = new ArrayList<>();
    for (Map<String, Object> row : database.queryAll("SELECT * FROM push_config ORDER BY id")) {
      ChannelConfig config = toConfig(row);
      if (config != null) {
        configs.add(config);
      }
    }
    return configs;
  }

  public ChannelConfig getConfig(String channel) {
    Map<String, Object> row = database.queryOne("SELECT * FROM push_config WHERE channel = ?", channel);
    return row == null ? null : toConfig(row);
  }

  /**
   * Сохраняет настройку канала одной атомарной операцией MERGE, поэтому
   * гонка "обновить, затем вставить" не может потерять запись.
   *
   * @param config Параметры канала; {@code null} сохраняется как пустой объект.
   * @param events Подписки канала; {@code null} сохраняется как пустой список.
   * @return true, если настройка сохранена.
   */
  public boolean save(String channel, boolean enabled, Map<String, Object> config, Set<String> events, String now) {
    String configJson;
    String eventsJson;
    try {
      configJson = objectMapper.writeValueAsString(config == null ? Map.of() : config);
      eventsJson = objectMapper.writeValueAsString(events == null ? Set.of() : events);
    } catch (JsonProcessingException e) {
      logger.error("❌ Не удалось сериализовать настройку канала {}", channel, e);
      return false;
    }
    String sql = """
        MERGE INTO push_config (channel, enabled, config, events, updated_at)
        KEY (channel)
        VALUES (?, ?, ?, ?, ?)
        """;
    return database.execute(sql, channel, enabled, configJson, eventsJson, now) > 0;
  }

  private ChannelConfig toConfig(Map<String, Object> row) {
    String channel = String.valueOf(row.get("channel"));
    try {
      Object enabled = row.get("enabled");
      Map<String, Object> config = objectMapper.readValue(textOr(row.get("config"), "{}"), CONFIG_TYPE);
      Set<String> events = objectMapper.readValue(textOr(row.get("events"), "[]"), EVENTS_TYPE);
      Object updatedAt = row.get("updated_at");
      return new ChannelConfig(channel, Boolean.TRUE.equals(enabled), config, events,
          updatedAt == null ? null : updatedAt.toString());
    } catch (JsonProcessingException e) {
      logger.error("❌ Повреждена настройка канала {}", channel, e);
      return null;
    }
  }

  private static String textOr(Object value, String defaultValue) {
    return value == null || value.toString().isBlank() ? defaultValue : value.toString();
  }
}
