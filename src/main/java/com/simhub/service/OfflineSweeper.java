package com.simhub.service;

import com.simhub.db.DeviceDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Периодическая задача: переводит в offline устройства, которые не выходили
 * на связь дольше таймаута.
 * <p>
 * Работает через ту же БД и ту же блокировку, что и обработка запросов;
 * при гонке с входящим сообщением побеждает последняя запись.
 */
public class OfflineSweeper implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(OfflineSweeper.class);

  private final DeviceDao deviceDao;
  private final TimeNormalizer timeNormalizer;
  private final ScheduledExecutorService executor;

  public OfflineSweeper(DeviceDao deviceDao, TimeNormalizer timeNormalizer) {
    this.deviceDao = deviceDao;
    this.timeNormalizer = timeNormalizer;
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r, "offline-sweeper");
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Одним UPDATE переводит в offline все online-устройства с last_seen_at старше таймаута.
   *
   * @param timeoutSeconds Таймаут в секундах.
   * @return Количество устройств, переведённых в offline.
   */
  public int sweep(long timeoutSeconds) {
    int changed = deviceDao.markOfflineBefore(timeNormalizer.secondsAgo(timeoutSeconds), timeNormalizer.now());
    if (changed > 0) {
      logger.info("🔌 {} устройств(а) помечено как offline", changed);
    }
    return changed;
  }

  /**
   * Запускает проверку с фиксированным интервалом.
   *
   * @param intervalSeconds Интервал между проверками.
   * @param timeoutSeconds Таймаут неактивности.
   */
  public void start(long intervalSeconds, long timeoutSeconds) {
    executor.scheduleWithFixedDelay(() -> {
      try {
        sweep(timeoutSeconds);
      } catch (RuntimeException e) {
        logger.error("❌ Ошибка проверки offline-устройств", e);
      }
    }, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    logger.info("Проверка offline-устройств: каждые {} с, таймаут {} с", intervalSeconds, timeoutSeconds);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
