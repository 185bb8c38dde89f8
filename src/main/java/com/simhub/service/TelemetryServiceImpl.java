package com.simhub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simhub.codec.GatewayEvent;
import com.simhub.db.CallRecordDao;
import com.simhub.db.DeviceDao;
import com.simhub.db.MessageDao;
import com.simhub.db.SimCardDao;
import com.simhub.db.SmsRecordDao;
import com.simhub.event.EventClassifier;
import com.simhub.event.EventType;
import com.simhub.model.CallRecord;
import com.simhub.model.SimStatus;
import com.simhub.model.SmsRecord;
import com.simhub.notify.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Реализация сервиса обработки сообщений шлюзов.
 * <p>
 * Все обработчики выполняют идемпотентные upsert'ы устройств и SIM-карт плюс
 * добавление в журналы. Отсутствующие необязательные поля заменяются
 * пустыми значениями, а не приводят к ошибке.
 */
public class TelemetryServiceImpl implements TelemetryService {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryServiceImpl.class);

  /** SIM-коды, о которых уведомлять не нужно: регистрация и получение ID идут пачками. */
  private static final Set<Integer> QUIET_SIM_TYPES = Set.of(202, 203);

  /** Звонки, о которых уведомляем: входящий вызов, сброс звонящим, завершение исходящего. */
  private static final Set<Integer> NOTIFIED_CALL_TYPES = Set.of(601, 603, 623);

  private static final int HEARTBEAT_TYPE = 998;
  private static final int SMS_SENT_TYPE = 502;

  private final DeviceDao deviceDao;
  private final SimCardDao simCardDao;
  private final MessageDao messageDao;
  private final SmsRecordDao smsRecordDao;
  private final CallRecordDao callRecordDao;
  private final NotificationService notificationService;
  private final TimeNormalizer timeNormalizer;
  private final ObjectMapper objectMapper;
  private final boolean rawMessagesEnabled;

  /**
   * Конструктор сервиса.
   *
   * @param rawMessagesEnabled Сохранять ли каждое сообщение в журнал messages.
   */
  public TelemetryServiceImpl(DeviceDao deviceDao, SimCardDao simCardDao, MessageDao messageDao,
                              SmsRecordDao smsRecordDao, CallRecordDao callRecordDao,
                              NotificationService notificationService, TimeNormalizer timeNormalizer,
                              ObjectMapper objectMapper, boolean rawMessagesEnabled) {
    this.deviceDao = deviceDao;
    this.simCardDao = simCardDao;
    this.messageDao = messageDao;
    this.smsRecordDao = smsRecordDao;
    this.callRecordDao = callRecordDao;
    this.notificationService = notificationService;
    this.timeNormalizer = timeNormalizer;
    this.objectMapper = objectMapper;
    this.rawMessagesEnabled = rawMessagesEnabled;
  }

  @Override
  public boolean processTelemetry(GatewayEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }
    EventType type = EventClassifier.classify(event.getType());
    String now = timeNormalizer.now();

    boolean logged = !rawMessagesEnabled || recordMessage(event, type, now);

    boolean saved;
    switch (type.getCategory()) {
      case NETWORK:
        saved = handleNetwork(event, type, now);
        break;
      case SIM:
        saved = handleSim(event, type, now);
        break;
      case SMS:
        saved = handleSms(event, type, now);
        break;
      case CALL:
        saved = handleCall(event, type, now);
        break;
      case SYSTEM:
        saved = handleSystem(event, type, now);
        break;
      case MODULE:
      case COMMAND:
      case CALL_CONTROL:
        logger.info("📨 Устройство {}: {}", event.getDevId(), type.getLabel());
        saved = markSeen(event.getDevId(), now);
        break;
      default:
        logger.info("📨 Устройство {}: {}", event.getDevId(), type.getLabel());
        saved = logged;
        break;
    }

    if (!saved) {
      logger.error("❌ Не удалось сохранить сообщение type={} от устройства {}", event.getType(), event.getDevId());
    }
    return saved;
  }

  private boolean recordMessage(GatewayEvent event, EventType type, String now) {
    String raw;
    try {
      raw = objectMapper.writeValueAsString(event.getFields());
    } catch (JsonProcessingException e) {
      logger.warn("Не удалось сериализовать сообщение от {}", event.getDevId(), e);
      raw = String.valueOf(event.getFields());
    }
    boolean saved = messageDao.saveMessage(event.getDevId(), event.getType(), type.getLabel(), raw, now);
    if (!saved) {
      logger.error("❌ Не удалось записать сообщение в журнал. Устройство: {}", event.getDevId());
    }
    return saved;
  }

  private boolean handleNetwork(GatewayEvent event, EventType type, String now) {
    String devId = event.getDevId();
    String ip = orEmpty(event.getString(EventField.IP.keys()));
    String ssid = orEmpty(event.getString(EventField.SSID.keys()));
    Long signal = event.getLong(EventField.SIGNAL.keys());
    String hwVer = orEmpty(event.getString(EventField.HW_VER.keys()));

    logger.info("🌐 Устройство {}: {}, IP: {}, SSID: {}", devId, type.getLabel(), ip, ssid);

    boolean saved = deviceDao.upsertNetworkState(devId, ip, ssid, signal == null ? 0 : signal.intValue(), hwVer, now);
    if (saved) {
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("devId", devId);
      data.put("status", type.getLabel());
      data.put("ip", ip.isEmpty() ? "unknown" : ip);
      publish(NotificationService.DEVICE_STATUS, data);
    }
    return saved;
  }

  private boolean handleSim(GatewayEvent event, EventType type, String now) {
    String devId = event.getDevId();
    Integer slot = event.getInteger("slot");
    String status = SimStatus.fromMessageType(event.getType());

    logger.info("📶 Устройство {} слот {}: {}", devId, slot, type.getLabel());

    if (!deviceDao.ensureDevice(devId, now)) {
      return false;
    }
    boolean saved = true;
    String iccid = event.getString(EventField.ICCID.keys());
    if (slot == null) {
      logger.warn("⚠️ SIM-сообщение type={} от {} без номера слота, SIM-карта не обновлена", event.getType(), devId);
    } else {
      Long signal = event.getLong(EventField.SIGNAL.keys());
      saved = simCardDao.upsertSimCard(devId, slot,
          iccid,
          event.getString(EventField.IMSI.keys()),
          event.getString(EventField.MSISDN.keys()),
          signal == null ? null : signal.intValue(),
          event.getString(EventField.PLMN.keys()),
          status,
          now);
    }
    saved = deviceDao.touch(devId, now) && saved;

    if (saved && !QUIET_SIM_TYPES.contains(event.getType())) {
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("devId", devId);
      data.put("slot", slot == null ? "" : slot);
      data.put("status", type.getLabel());
      data.put("iccid", orEmpty(iccid));
      publish(NotificationService.SIM, data);
    }
    return saved;
  }

  private boolean handleSms(GatewayEvent event, EventType type, String now) {
    String devId = event.getDevId();
    Integer slot = event.getInteger("slot");
    String phoneNum = orEmpty(event.getString(EventField.PHONE.keys()));
    String content = orEmpty(event.getString(EventField.SMS_CONTENT.keys()));
    String direction = event.getType() == SMS_SENT_TYPE ? SmsRecord.DIRECTION_OUT : SmsRecord.DIRECTION_IN;

    int offset = simCardDao.findTimezoneOffset(devId, slot, event.getString(EventField.IMSI.keys()));
    String smsTime = timeNormalizer.normalize(event.get(EventField.SMS_TIME.keys()), offset);

    logger.info("✉️ SMS ({}) устройство {} слот {}: {}", direction, devId, slot, phoneNum);

    if (!deviceDao.ensureDevice(devId, now)) {
      return false;
    }
    SmsRecord sms = new SmsRecord(devId, slot == null ? 0 : slot, phoneNum, content, smsTime, direction, now);
    boolean saved = smsRecordDao.saveSms(sms);
    saved = deviceDao.touch(devId, now) && saved;

    if (saved) {
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("devId", devId);
      data.put("slot", sms.getSlot());
      data.put("phoneNum", phoneNum);
      data.put("content", content);
      data.put("direction", direction);
      data.put("time", smsTime);
      publish(NotificationService.SMS, data);
    }
    return saved;
  }

  private boolean handleCall(GatewayEvent event, EventType type, String now) {
    String devId = event.getDevId();
    Integer slot = event.getInteger("slot");
    String phoneNum = orEmpty(event.getString(EventField.PHONE.keys()));

    Object rawStart = event.get(EventField.CALL_START.keys());
    int offset = simCardDao.findTimezoneOffset(devId, slot, event.getString(EventField.IMSI.keys()));
    String startTime = timeNormalizer.normalize(rawStart, offset);
    long duration = duration(rawStart, event.get(EventField.CALL_END.keys()));

    logger.info("📞 Устройство {} слот {}: {} ({})", devId, slot, phoneNum, type.getLabel());

    if (!deviceDao.ensureDevice(devId, now)) {
      return false;
    }
    CallRecord call = new CallRecord(devId, slot == null ? 0 : slot, phoneNum, event.getType(),
        type.getLabel(), startTime, duration, now);
    boolean saved = callRecordDao.saveCall(call);
    saved = deviceDao.touch(devId, now) && saved;

    if (saved && NOTIFIED_CALL_TYPES.contains(event.getType())) {
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("devId", devId);
      data.put("slot", call.getSlot());
      data.put("phoneNum", phoneNum);
      data.put("callType", type.getLabel());
      data.put("time", startTime);
      data.put("durationSeconds", duration);
      publish(NotificationService.CALL, data);
    }
    return saved;
  }

  private boolean handleSystem(GatewayEvent event, EventType type, String now) {
    String devId = event.getDevId();
    logger.debug("💓 Устройство {}: {}", devId, type.getLabel());
    boolean saved = markSeen(devId, now);
    if (saved && event.getType() != HEARTBEAT_TYPE) {
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("devId", devId);
      data.put("status", type.getLabel());
      publish(NotificationService.SYSTEM, data);
    }
    return saved;
  }

  private boolean markSeen(String devId, String now) {
    return deviceDao.ensureDevice(devId, now) && deviceDao.touch(devId, now);
  }

  static long duration(Object rawStart, Object rawEnd) {
    Long start = TimeNormalizer.toEpochSeconds(rawStart);
    Long end = TimeNormalizer.toEpochSeconds(rawEnd);
    if (start == null || end == null || start <= 0 || end <= start) {
      return 0;
    }
    return end - start;
  }

  private void publish(String event, Map<String, Object> data) {
    try {
      notificationService.publish(event, data);
    } catch (RuntimeException e) {
      logger.error("❌ Не удалось поставить уведомление '{}' в очередь", event, e);
    }
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }
}
