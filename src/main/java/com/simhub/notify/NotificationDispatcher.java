package com.simhub.notify;

import com.simhub.db.ChannelConfigDao;
import com.simhub.model.ChannelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Рассылает события во все включённые каналы, подписанные на категорию.
 * <p>
 * {@link #publish} кладёт событие в ограниченную очередь, которую разбирают
 * фоновые потоки; при переполнении событие отбрасывается с предупреждением.
 * Внутри одной рассылки каналы опрашиваются параллельно, результат собирается
 * по всем каналам: ошибка одного канала не задерживает и не отменяет остальные.
 * Канал, не ответивший за отведённое время, считается недоставленным.
 * Доставка не более одного раза, без повторов.
 */
public class NotificationDispatcher implements NotificationService, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final ChannelConfigDao channelConfigDao;
  private final MessageFormatter formatter;
  private final Map<String, ChannelSender> senders = new LinkedHashMap<>();
  private final ThreadPoolExecutor queue;
  private final ExecutorService deliveryExecutor;
  private final long timeoutSeconds;

  /**
   * @param senders Адаптеры каналов; имя канала берётся из {@link ChannelSender#channel()}.
   * @param workers Количество потоков, разбирающих очередь.
   * @param queueCapacity Ёмкость очереди событий.
   * @param timeoutSeconds Сколько ждать ответа канала и разбора очереди при остановке.
   */
  public NotificationDispatcher(ChannelConfigDao channelConfigDao, MessageFormatter formatter,
                                List<ChannelSender> senders, int workers, int queueCapacity,
                                long timeoutSeconds) {
    this.channelConfigDao = channelConfigDao;
    this.formatter = formatter;
    for (ChannelSender sender : senders) {
      this.senders.put(sender.channel(), sender);
    }
    this.queue = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity), daemonThreads("notify-queue"));
    this.deliveryExecutor = Executors.newCachedThreadPool(daemonThreads("notify-send"));
    this.timeoutSeconds = timeoutSeconds;
  }

  @Override
  public void publish(String event, Map<String, Object> data) {
    Map<String, Object> snapshot = new LinkedHashMap<>(data);
    try {
      queue.execute(() -> {
        try {
          dispatch(event, snapshot);
        } catch (RuntimeException e) {
          logger.error("❌ Рассылка события '{}' прервана", event, e);
        }
      });
    } catch (RejectedExecutionException e) {
      logger.warn("⚠️ Очередь уведомлений переполнена или остановлена, событие '{}' отброшено", event);
    }
  }

  /**
   * Синхронно рассылает событие во все подходящие каналы.
   *
   * @param event Категория события.
   * @param data Данные события.
   * @return Результат по каждому каналу, в который была попытка доставки. Никогда не бросает.
   */
  public List<DeliveryResult> dispatch(String event, Map<String, Object> data) {
    List<ChannelConfig> targets = new ArrayList<>();
    for (ChannelConfig config : channelConfigDao.getAllConfigs()) {
      if (config.accepts(event)) {
        targets.add(config);
      }
    }
    if (targets.isEmpty()) {
      return List.of();
    }
    NotificationMessage message = formatter.format(event, data);
    if (message == null) {
      logger.warn("Нет шаблона уведомления для события '{}'", event);
      return List.of();
    }
    return deliverAll(targets, message);
  }

  /**
   * Отправляет тестовое сообщение в канал независимо от его подписок и флага enabled.
   *
   * @param channel Имя канала.
   * @return Результат доставки.
   */
  public DeliveryResult sendTest(String channel) {
    ChannelConfig config = channelConfigDao.getConfig(channel);
    if (config == null) {
      return DeliveryResult.failure(channel, "Канал не найден");
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("channel", channel);
    return deliverAll(List.of(config), formatter.format(MessageFormatter.TEST, data)).get(0);
  }

  private List<DeliveryResult> deliverAll(List<ChannelConfig> targets, NotificationMessage message) {
    List<CompletableFuture<DeliveryResult>> futures = new ArrayList<>();
    for (ChannelConfig config : targets) {
      try {
        futures.add(CompletableFuture.supplyAsync(() -> deliver(config, message), deliveryExecutor)
            .completeOnTimeout(timedOut(config.getChannel()), timeoutSeconds, TimeUnit.SECONDS));
      } catch (RejectedExecutionException e) {
        futures.add(CompletableFuture.completedFuture(
            DeliveryResult.failure(config.getChannel(), "Рассылка остановлена")));
      }
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<DeliveryResult> results = new ArrayList<>();
    for (CompletableFuture<DeliveryResult> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  private DeliveryResult timedOut(String channel) {
    return DeliveryResult.failure(channel, "Канал не ответил за " + timeoutSeconds + " с");
  }

  private DeliveryResult deliver(ChannelConfig config, NotificationMessage message) {
    String channel = config.getChannel();
    ChannelSender sender = senders.get(channel);
    if (sender == null) {
      logger.warn("Канал '{}' не поддерживается", channel);
      return DeliveryResult.failure(channel, "Неподдерживаемый канал");
    }
    try {
      sender.send(config, message);
      logger.info("✅ Уведомление '{}' доставлено в {}", message.getTitle(), channel);
      return DeliveryResult.success(channel);
    } catch (NotificationException e) {
      logger.error("❌ Ошибка доставки в {}: {}", channel, e.getMessage(), e);
      return DeliveryResult.failure(channel, e.getMessage());
    } catch (RuntimeException e) {
      logger.error("❌ Непредвиденная ошибка канала {}", channel, e);
      return DeliveryResult.failure(channel, String.valueOf(e.getMessage()));
    }
  }

  /**
   * Прекращает приём событий, ждёт разбора очереди и останавливает потоки.
   */
  @Override
  public void close() {
    queue.shutdown();
    try {
      if (!queue.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
        logger.warn("⚠️ Очередь уведомлений не разобрана за {} с, оставшиеся события отброшены", timeoutSeconds);
        queue.shutdownNow();
      }
    } catch (InterruptedException e) {
      queue.shutdownNow();
      Thread.currentThread().interrupt();
    }
    deliveryExecutor.shutdownNow();
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
