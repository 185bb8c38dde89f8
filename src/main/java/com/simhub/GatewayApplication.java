package com.simhub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simhub.codec.EncryptionSettings;
import com.simhub.codec.PayloadDecoder;
import com.simhub.config.AppSettings;
import com.simhub.db.CallRecordDao;
import com.simhub.db.ChannelConfigDao;
import com.simhub.db.Database;
import com.simhub.db.DeviceDao;
import com.simhub.db.MessageDao;
import com.simhub.db.SimCardDao;
import com.simhub.db.SmsRecordDao;
import com.simhub.db.SnapshotScheduler;
import com.simhub.notify.ChannelSender;
import com.simhub.notify.FeishuSender;
import com.simhub.notify.MessageFormatter;
import com.simhub.notify.NotificationDispatcher;
import com.simhub.notify.SmtpSender;
import com.simhub.notify.WeComSender;
import com.simhub.service.OfflineSweeper;
import com.simhub.service.TelemetryService;
import com.simhub.service.TelemetryServiceImpl;
import com.simhub.service.TimeNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

/**
 * Сборка всех компонентов шлюза: БД, DAO, рассылка уведомлений, сервис
 * обработки и фоновые задачи.
 */
public class GatewayApplication implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(GatewayApplication.class);

  private static final int SECONDS_PER_DAY = 86_400;

  private final AppSettings settings;
  private final Database database;
  private final DeviceDao deviceDao;
  private final SimCardDao simCardDao;
  private final MessageDao messageDao;
  private final ChannelConfigDao channelConfigDao;
  private final TimeNormalizer timeNormalizer;
  private final PayloadDecoder payloadDecoder;
  private final NotificationDispatcher dispatcher;
  private final TelemetryService telemetryService;
  private final OfflineSweeper offlineSweeper;
  private final SnapshotScheduler snapshotScheduler;

  private GatewayApplication(AppSettings settings) {
    this.settings = settings;
    ObjectMapper objectMapper = new ObjectMapper();

    this.database = new Database(settings.getSnapshotPath());
    database.open();

    this.deviceDao = new DeviceDao(database);
    this.simCardDao = new SimCardDao(database);
    this.messageDao = new MessageDao(database);
    this.channelConfigDao = new ChannelConfigDao(database, objectMapper);
    this.timeNormalizer = new TimeNormalizer();
    this.payloadDecoder = new PayloadDecoder(objectMapper, EncryptionSettings.from(settings));

    Duration timeout = Duration.ofSeconds(settings.getNotifyTimeoutSeconds());
    HttpClient httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    List<ChannelSender> senders = List.of(
        new WeComSender(httpClient, objectMapper, timeout),
        new FeishuSender(httpClient, objectMapper, timeout),
        new SmtpSender(timeout));
    this.dispatcher = new NotificationDispatcher(channelConfigDao, new MessageFormatter(timeNormalizer),
        senders, settings.getNotifyWorkers(), settings.getNotifyQueueCapacity(),
        settings.getNotifyTimeoutSeconds());

    this.telemetryService = new TelemetryServiceImpl(deviceDao, simCardDao, messageDao,
        new SmsRecordDao(database), new CallRecordDao(database), dispatcher, timeNormalizer,
        objectMapper, settings.isRawMessagesEnabled());

    this.offlineSweeper = new OfflineSweeper(deviceDao, timeNormalizer);
    this.snapshotScheduler = new SnapshotScheduler(database, this::cleanupMessages,
        settings.getSnapshotIntervalSeconds());
    cleanupMessages();
  }

  /**
   * Открывает БД (с восстановлением из снимка), чистит устаревший журнал и собирает компоненты.
   * Фоновые задачи не запускаются.
   *
   * @param settings Настройки приложения.
   * @return Готовое приложение.
   */
  public static GatewayApplication create(AppSettings settings) {
    return new GatewayApplication(settings);
  }

  /**
   * Запускает проверку offline-устройств и периодическое сохранение снимка.
   */
  public void startBackgroundTasks() {
    offlineSweeper.start(settings.getSweepIntervalSeconds(), settings.getOfflineTimeoutSeconds());
    snapshotScheduler.start();
  }

  /**
   * Удаляет записи журнала messages старше срока хранения. 0 отключает очистку.
   *
   * @return Количество удалённых записей.
   */
  public int cleanupMessages() {
    int days = settings.getRetentionDays();
    if (days <= 0) {
      return 0;
    }
    int removed = messageDao.deleteOlderThan(timeNormalizer.secondsAgo((long) days * SECONDS_PER_DAY));
    if (removed > 0) {
      logger.info("🧹 Удалено {} устаревших записей журнала", removed);
    }
    return removed;
  }

  public Database getDatabase() {
    return database;
  }

  public DeviceDao getDeviceDao() {
    return deviceDao;
  }

  public SimCardDao getSimCardDao() {
    return simCardDao;
  }

  public MessageDao getMessageDao() {
    return messageDao;
  }

  public ChannelConfigDao getChannelConfigDao() {
    return channelConfigDao;
  }

  public PayloadDecoder getPayloadDecoder() {
    return payloadDecoder;
  }

  public NotificationDispatcher getDispatcher() {
    return dispatcher;
  }

  public TelemetryService getTelemetryService() {
    return telemetryService;
  }

  /**
   * Останавливает фоновые задачи, дожидается очереди уведомлений и сохраняет финальный снимок.
   */
  @Override
  public void close() {
    offlineSweeper.close();
    snapshotScheduler.close();
    dispatcher.close();
    database.close();
    logger.info("Шлюз остановлен");
  }
}
