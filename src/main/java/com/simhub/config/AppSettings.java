package com.simhub.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Типизированный снимок настроек приложения.
 * <p>
 * В рабочем режиме собирается из {@link Config} методом {@link #load()};
 * в тестах удобнее использовать {@link #builder()}.
 */
public final class AppSettings {

  private final int port;
  private final Path snapshotPath;
  private final int snapshotIntervalSeconds;
  private final boolean aesEnabled;
  private final String aesKey;
  private final String aesIv;
  private final boolean rawMessagesEnabled;
  private final int retentionDays;
  private final int offlineTimeoutSeconds;
  private final int sweepIntervalSeconds;
  private final int notifyTimeoutSeconds;
  private final int notifyQueueCapacity;
  private final int notifyWorkers;

  private AppSettings(Builder b) {
    this.port = b.port;
    this.snapshotPath = b.snapshotPath;
    this.snapshotIntervalSeconds = b.snapshotIntervalSeconds;
    this.aesEnabled = b.aesEnabled;
    this.aesKey = b.aesKey;
    this.aesIv = b.aesIv;
    this.rawMessagesEnabled = b.rawMessagesEnabled;
    this.retentionDays = b.retentionDays;
    this.offlineTimeoutSeconds = b.offlineTimeoutSeconds;
    this.sweepIntervalSeconds = b.sweepIntervalSeconds;
    this.notifyTimeoutSeconds = b.notifyTimeoutSeconds;
    this.notifyQueueCapacity = b.notifyQueueCapacity;
    this.notifyWorkers = b.notifyWorkers;
  }

  /**
   * Читает настройки из application.properties с учётом системных свойств.
   *
   * @return Заполненный объект настроек.
   */
  public static AppSettings load() {
    return builder()
        .port(Config.getIntProperty("server.port", 3000))
        .snapshotPath(Paths.get(Config.getRequiredProperty("db.snapshot.path")))
        .snapshotIntervalSeconds(Config.getIntProperty("db.snapshot.interval.seconds", 30))
        .aesEnabled(Config.getBooleanProperty("aes.enabled", false))
        .aesKey(Config.getProperty("aes.key", ""))
        .aesIv(Config.getProperty("aes.iv", ""))
        .rawMessagesEnabled(Config.getBooleanProperty("log.raw.messages", true))
        .retentionDays(Config.getIntProperty("log.retention.days", 7))
        .offlineTimeoutSeconds(Config.getIntProperty("device.offline.timeout.seconds", 300))
        .sweepIntervalSeconds(Config.getIntProperty("device.offline.sweep.interval.seconds", 300))
        .notifyTimeoutSeconds(Config.getIntProperty("notify.timeout.seconds", 10))
        .notifyQueueCapacity(Config.getIntProperty("notify.queue.capacity", 256))
        .notifyWorkers(Config.getIntProperty("notify.workers", 2))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getPort() {
    return port;
  }

  public Path getSnapshotPath() {
    return snapshotPath;
  }

  public int getSnapshotIntervalSeconds() {
    return snapshotIntervalSeconds;
  }

  public boolean isAesEnabled() {
    return aesEnabled;
  }

  public String getAesKey() {
    return aesKey;
  }

  public String getAesIv() {
    return aesIv;
  }

  /**
   * @return true, если каждое входящее событие сохраняется в журнал messages.
   */
  public boolean isRawMessagesEnabled() {
    return rawMessagesEnabled;
  }

  /**
   * @return Сколько дней хранить журнал messages; 0 отключает очистку.
   */
  public int getRetentionDays() {
    return retentionDays;
  }

  public int getOfflineTimeoutSeconds() {
    return offlineTimeoutSeconds;
  }

  public int getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  public int getNotifyTimeoutSeconds() {
    return notifyTimeoutSeconds;
  }

  public int getNotifyQueueCapacity() {
    return notifyQueueCapacity;
  }

  public int getNotifyWorkers() {
    return notifyWorkers;
  }

  public static final class Builder {
    private int port = 3000;
    private Path snapshotPath = Paths.get("data", "simhub.sql");
    private int snapshotIntervalSeconds = 30;
    private boolean aesEnabled;
    private String aesKey = "";
    private String aesIv = "";
    private boolean rawMessagesEnabled = true;
    private int retentionDays = 7;
    private int offlineTimeoutSeconds = 300;
    private int sweepIntervalSeconds = 300;
    private int notifyTimeoutSeconds = 10;
    private int notifyQueueCapacity = 256;
    private int notifyWorkers = 2;

    private Builder() {
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder snapshotPath(Path snapshotPath) {
      this.snapshotPath = snapshotPath;
      return this;
    }

    public Builder snapshotIntervalSeconds(int seconds) {
      this.snapshotIntervalSeconds = seconds;
      return this;
    }

    public Builder aesEnabled(boolean aesEnabled) {
      this.aesEnabled = aesEnabled;
      return this;
    }

    public Builder aesKey(String aesKey) {
      this.aesKey = aesKey;
      return this;
    }

    public Builder aesIv(String aesIv) {
      this.aesIv = aesIv;
      return this;
    }

    public Builder rawMessagesEnabled(boolean enabled) {
      this.rawMessagesEnabled = enabled;
      return this;
    }

    public Builder retentionDays(int days) {
      this.retentionDays = days;
      return this;
    }

    public Builder offlineTimeoutSeconds(int seconds) {
      this.offlineTimeoutSeconds = seconds;
      return this;
    }

    public Builder sweepIntervalSeconds(int seconds) {
      this.sweepIntervalSeconds = seconds;
      return this;
    }

    public Builder notifyTimeoutSeconds(int seconds) {
      this.notifyTimeoutSeconds = seconds;
      return this;
    }

    public Builder notifyQueueCapacity(int capacity) {
      this.notifyQueueCapacity = capacity;
      return this;
    }

    public Builder notifyWorkers(int workers) {
      this.notifyWorkers = workers;
      return this;
    }

    public AppSettings build() {
      return new AppSettings(this);
    }
  }
}
