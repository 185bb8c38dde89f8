package com.simhub.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Страховочный таймер: периодически выполняет обслуживание (очистку старых
 * журналов) и пишет полный снимок БД независимо от входящего трафика.
 */
public class SnapshotScheduler implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(SnapshotScheduler.class);

  private final Database database;
  private final Runnable maintenance;
  private final int intervalSeconds;
  private final ScheduledExecutorService executor;

  /**
   * @param database БД, снимок которой сохраняется.
   * @param maintenance Действие перед каждым снимком (может быть пустым).
   * @param intervalSeconds Период в секундах.
   */
  public SnapshotScheduler(Database database, Runnable maintenance, int intervalSeconds) {
    this.database = database;
    this.maintenance = maintenance;
    this.intervalSeconds = intervalSeconds;
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r, "db-snapshot");
      thread.setDaemon(true);
      return thread;
    });
  }

  public void start() {
    executor.scheduleWithFixedDelay(this::tick, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    logger.info("Снимок БД по таймеру: каждые {} с", intervalSeconds);
  }

  void tick() {
    try {
      maintenance.run();
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка обслуживания БД перед снимком", e);
    }
    database.snapshot();
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
