package com.simhub.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Настройка канала уведомлений (wecom, feishu, smtp): одна строка на канал.
 */
public class ChannelConfig {

  public static final String WECOM = "wecom";
  public static final String FEISHU = "feishu";
  public static final String SMTP = "smtp";

  private final String channel;
  private final boolean enabled;
  private final Map<String, Object> config;
  private final Set<String> events;
  private final String updatedAt;

  public ChannelConfig(String channel, boolean enabled, Map<String, Object> config,
                       Set<String> events, String updatedAt) {
    this.channel = channel;
    this.enabled = enabled;
    this.config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    this.events = events == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(events));
    this.updatedAt = updatedAt;
  }

  public String getChannel() {
    return channel;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * @return Параметры подключения канала: webhook для чатов, host/user/pass/to для SMTP.
   */
  public Map<String, Object> getConfig() {
    return config;
  }

  /**
   * @return Категории событий, на которые подписан канал.
   */
  public Set<String> getEvents() {
    return events;
  }

  public String getUpdatedAt() {
    return updatedAt;
  }

  /**
   * @param event Категория события (sms, call, device_status, ...).
   * @return true, если канал включён и подписан на событие.
   */
  public boolean accepts(String event) {
    return enabled && events.contains(event);
  }

  public String getString(String key) {
    Object value = config.get(key);
    if (value == null) {
      return null;
    }
    String text = value.toString().trim();
    return text.isEmpty() ? null : text;
  }
}
