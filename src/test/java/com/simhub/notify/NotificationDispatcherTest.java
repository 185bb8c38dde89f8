package com.simhub.notify;

import com.simhub.db.ChannelConfigDao;
import com.simhub.model.ChannelConfig;
import com.simhub.service.TimeNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NotificationDispatcherTest {

  private ChannelConfigDao channelConfigDao;
  private ChannelSender wecom;
  private ChannelSender feishu;
  private ChannelSender smtp;
  private NotificationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    channelConfigDao = mock(ChannelConfigDao.class);
    wecom = sender(ChannelConfig.WECOM);
    feishu = sender(ChannelConfig.FEISHU);
    smtp = sender(ChannelConfig.SMTP);
    MessageFormatter formatter = new MessageFormatter(
        new TimeNormalizer(Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC)));
    dispatcher = new NotificationDispatcher(channelConfigDao, formatter, List.of(wecom, feishu, smtp), 1, 4, 5);
  }

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  private static ChannelSender sender(String channel) {
    ChannelSender sender = mock(ChannelSender.class);
    when(sender.channel()).thenReturn(channel);
    return sender;
  }

  private static ChannelConfig config(String channel, boolean enabled, String... events) {
    return new ChannelConfig(channel, enabled, Map.of("webhook", "http://localhost/" + channel), Set.of(events), null);
  }

  private static Map<String, Object> smsData() {
    return Map.of("devId", "gw_1", "slot", 1, "phoneNum", "10086", "content", "hi",
        "direction", "in", "time", "2023-11-15 06:13:20");
  }

  @Test
  @DisplayName("Событие уходит только в включённые каналы, подписанные на категорию")
  void shouldDeliverOnlyToSubscribedEnabledChannels() throws Exception {
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(
        config(ChannelConfig.WECOM, true, "sms"),
        config(ChannelConfig.FEISHU, true, "call"),
        config(ChannelConfig.SMTP, false, "sms")));

    List<DeliveryResult> results = dispatcher.dispatch(NotificationService.SMS, smsData());

    assertThat(results).extracting(DeliveryResult::getChannel).containsExactly(ChannelConfig.WECOM);
    assertThat(results.get(0).isSuccess()).isTrue();
    verify(wecom).send(any(ChannelConfig.class), any(NotificationMessage.class));
    verify(feishu, never()).send(any(), any());
    verify(smtp, never()).send(any(), any());
  }

  @Test
  @DisplayName("Ошибка одного канала не мешает доставке в остальные")
  void shouldIsolateChannelFailures() throws Exception {
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(
        config(ChannelConfig.WECOM, true, "sms"),
        config(ChannelConfig.FEISHU, true, "sms"),
        config(ChannelConfig.SMTP, true, "sms")));
    doThrow(new NotificationException("WeCom errcode=93000")).when(wecom).send(any(), any());
    doThrow(new IllegalStateException("unexpected")).when(smtp).send(any(), any());

    List<DeliveryResult> results = dispatcher.dispatch(NotificationService.SMS, smsData());

    assertThat(results).hasSize(3);
    assertThat(results.get(0).isSuccess()).isFalse();
    assertThat(results.get(0).getError()).contains("93000");
    assertThat(results.get(1).isSuccess()).isTrue();
    assertThat(results.get(2).isSuccess()).isFalse();
  }

  @Test
  @DisplayName("Канал без адаптера даёт неуспешный результат, а не исключение")
  void shouldReportUnsupportedChannel() {
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(config("telegram", true, "sms")));

    List<DeliveryResult> results = dispatcher.dispatch(NotificationService.SMS, smsData());

    assertThat(results).hasSize(1);
    assertThat(results.get(0).isSuccess()).isFalse();
  }

  @Test
  @DisplayName("Событие без шаблона не рассылается")
  void shouldSkipEventWithoutTemplate() throws Exception {
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(config(ChannelConfig.WECOM, true, "weather")));

    assertThat(dispatcher.dispatch("weather", Map.of())).isEmpty();
    verify(wecom, never()).send(any(), any());
  }

  @Test
  @DisplayName("publish не блокирует и доставляет в фоне")
  void shouldDeliverPublishedEventAsynchronously() throws Exception {
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(config(ChannelConfig.FEISHU, true, "call")));
    CountDownLatch delivered = new CountDownLatch(1);
    doAnswer(invocation -> {
      delivered.countDown();
      return null;
    }).when(feishu).send(any(), any());

    dispatcher.publish(NotificationService.CALL,
        Map.of("devId", "gw_1", "slot", 1, "phoneNum", "10010", "callType", "Incoming call ringing", "time", "x"));

    assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  @DisplayName("Переполненная очередь отбрасывает событие без исключения")
  void shouldDropEventsWhenQueueIsFull() throws Exception {
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(config(ChannelConfig.WECOM, true, "sms")));
    CountDownLatch release = new CountDownLatch(1);
    doAnswer(invocation -> {
      release.await(5, TimeUnit.SECONDS);
      return null;
    }).when(wecom).send(any(), any());

    assertThatCode(() -> {
      for (int i = 0; i < 20; i++) {
        dispatcher.publish(NotificationService.SMS, smsData());
      }
    }).doesNotThrowAnyException();
    release.countDown();
  }

  @Test
  @DisplayName("Тестовое сообщение уходит даже в выключенный канал")
  void shouldSendTestMessageToDisabledChannel() throws Exception {
    when(channelConfigDao.getConfig(ChannelConfig.SMTP)).thenReturn(config(ChannelConfig.SMTP, false));

    DeliveryResult result = dispatcher.sendTest(ChannelConfig.SMTP);

    assertThat(result.isSuccess()).isTrue();
    verify(smtp).send(any(ChannelConfig.class), any(NotificationMessage.class));
  }

  @Test
  @DisplayName("Тестовое сообщение в неизвестный канал → неуспех")
  void shouldFailTestForUnknownChannel() {
    assertThat(dispatcher.sendTest("nope").isSuccess()).isFalse();
  }

  @Test
  @DisplayName("После остановки publish не бросает")
  void shouldIgnorePublishAfterClose() {
    dispatcher.close();

    assertThatCode(() -> dispatcher.publish(NotificationService.SMS, smsData())).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("Канал с пустыми подписками не ломает рассылку")
  void shouldTolerateChannelWithoutEvents() throws Exception {
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(
        new ChannelConfig(ChannelConfig.WECOM, true, null, null, null),
        config(ChannelConfig.FEISHU, true, "sms")));

    List<DeliveryResult> results = dispatcher.dispatch(NotificationService.SMS, smsData());

    assertThat(results).extracting(DeliveryResult::getChannel).containsExactly(ChannelConfig.FEISHU);
    verify(wecom, never()).send(any(), any());
  }

  @Test
  @DisplayName("Зависший канал не задерживает рассылку дольше таймаута")
  void shouldBoundWaitForHangingChannel() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    doAnswer(invocation -> {
      release.await(30, TimeUnit.SECONDS);
      return null;
    }).when(wecom).send(any(), any());
    when(channelConfigDao.getAllConfigs()).thenReturn(List.of(
        config(ChannelConfig.WECOM, true, "sms"),
        config(ChannelConfig.FEISHU, true, "sms")));
    MessageFormatter formatter = new MessageFormatter(
        new TimeNormalizer(Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC)));

    try (NotificationDispatcher shortTimeout = new NotificationDispatcher(channelConfigDao, formatter,
        List.of(wecom, feishu, smtp), 1, 4, 1)) {
      long started = System.nanoTime();
      List<DeliveryResult> results = shortTimeout.dispatch(NotificationService.SMS, smsData());
      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

      assertThat(elapsedMillis).isLessThan(10_000);
      assertThat(results).hasSize(2);
      assertThat(results.get(0).isSuccess()).isFalse();
      assertThat(results.get(1).isSuccess()).isTrue();
    } finally {
      release.countDown();
    }
  }
}
