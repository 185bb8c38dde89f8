package com.simhub.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simhub.codec.EncryptionSettings;
import com.simhub.codec.GatewayEvent;
import com.simhub.codec.PayloadDecoder;
import com.simhub.service.TelemetryService;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Модульные тесты для HttpServerHandler.
 * <p>
 * Проверяют HTTP-уровень: маршруты, разбор тела, коды ответа.
 * Обработка сообщений (TelemetryService) замокана, но проверяется,
 * что в неё передаётся корректное событие.
 */
class HttpServerHandlerTest {

  @Mock
  private TelemetryService telemetryService;

  @Mock
  private ChannelHandlerContext ctx;

  @Mock
  private ChannelPromise channelPromise;

  private HttpServerHandler handler;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    PayloadDecoder decoder = new PayloadDecoder(new ObjectMapper(), EncryptionSettings.disabled());
    handler = new HttpServerHandler(decoder, telemetryService);

    // Настраиваем моки так, чтобы ctx.writeAndFlush не падал
    when(ctx.writeAndFlush(any())).thenReturn(channelPromise);
    when(channelPromise.addListener(any())).thenReturn(channelPromise);
  }

  private static FullHttpRequest post(String uri, String body, String contentType) {
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        HttpMethod.POST,
        uri,
        Unpooled.wrappedBuffer(body.getBytes(StandardCharsets.UTF_8))
    );
    request.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.getBytes(StandardCharsets.UTF_8).length);
    request.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
    return request;
  }

  private FullHttpResponse captureResponse() {
    ArgumentCaptor<FullHttpResponse> responseCaptor = ArgumentCaptor.forClass(FullHttpResponse.class);
    verify(ctx).writeAndFlush(responseCaptor.capture());
    return responseCaptor.getValue();
  }

  @Test
  @DisplayName("Валидный POST /push → вызывает service с корректным событием")
  void shouldParseValidJsonAndPassToService() {
    // Given
    String jsonBody = "{\"devId\":\"gw_01\",\"type\":501,\"slot\":1,\"phNum\":\"+8613800000000\",\"smsBd\":\"hello\"}";
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenReturn(true);

    // When
    handler.channelRead0(ctx, post("/push", jsonBody, "application/json"));

    // Then
    ArgumentCaptor<GatewayEvent> captor = ArgumentCaptor.forClass(GatewayEvent.class);
    verify(telemetryService).processTelemetry(captor.capture());

    GatewayEvent event = captor.getValue();
    assertThat(event.getDevId()).isEqualTo("gw_01");
    assertThat(event.getType()).isEqualTo(501);
    assertThat(event.getInteger("slot")).isEqualTo(1);
    assertThat(event.getString("smsBd")).isEqualTo("hello");
  }

  @Test
  @DisplayName("Валидный запрос + service вернул true → 200 и code=0")
  void shouldReturn200WhenServiceReturnsTrue() {
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenReturn(true);

    handler.channelRead0(ctx, post("/push", "{\"devId\":\"gw_01\",\"type\":998}", "application/json"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    String content = response.content().toString(StandardCharsets.UTF_8);
    assertThat(content).isEqualTo("{\"code\":0,\"message\":\"OK\"}");
    assertThat(response.headers().get(HttpHeaderNames.CONTENT_TYPE)).startsWith("application/json");
  }

  @Test
  @DisplayName("Валидный запрос + service вернул false → 500 Processing failed")
  void shouldReturn500WhenServiceReturnsFalse() {
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenReturn(false);

    handler.channelRead0(ctx, post("/push", "{\"devId\":\"gw_01\",\"type\":998}", "application/json"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.content().toString(StandardCharsets.UTF_8))
        .isEqualTo("{\"code\":-1,\"message\":\"Processing failed\"}");
  }

  @Test
  @DisplayName("Исключение в service → 500, исключение не выходит за пределы обработчика")
  void shouldReturn500WhenServiceThrows() {
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenThrow(new IllegalStateException("boom"));

    handler.channelRead0(ctx, post("/push", "{\"devId\":\"gw_01\",\"type\":998}", "application/json"));

    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
  }

  @Test
  @DisplayName("Невалидный JSON → 400, service не вызывается")
  void shouldReturn400OnInvalidJson() {
    handler.channelRead0(ctx, post("/push", "{not json", "application/json"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"code\":-1");
    verifyNoInteractions(telemetryService);
  }

  @Test
  @DisplayName("Нет devId → 400, service не вызывается")
  void shouldReturn400WhenDevIdMissing() {
    handler.channelRead0(ctx, post("/push", "{\"type\":501}", "application/json"));

    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    verifyNoInteractions(telemetryService);
  }

  @Test
  @DisplayName("type не целое число → 400")
  void shouldReturn400WhenTypeIsNotInteger() {
    handler.channelRead0(ctx, post("/push", "{\"devId\":\"gw_01\",\"type\":\"sms\"}", "application/json"));

    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    verifyNoInteractions(telemetryService);
  }

  @Test
  @DisplayName("POST /push с form Content-Type разбирается как форма")
  void shouldDecodeFormBodyOnPushWhenContentTypeIsForm() {
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenReturn(true);

    handler.channelRead0(ctx, post("/push", "devId=gw_02&type=100&ip=10.0.0.5",
        "application/x-www-form-urlencoded; charset=UTF-8"));

    ArgumentCaptor<GatewayEvent> captor = ArgumentCaptor.forClass(GatewayEvent.class);
    verify(telemetryService).processTelemetry(captor.capture());
    assertThat(captor.getValue().getDevId()).isEqualTo("gw_02");
    assertThat(captor.getValue().getType()).isEqualTo(100);
    assertThat(captor.getValue().getString("ip")).isEqualTo("10.0.0.5");
    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.OK);
  }

  @Test
  @DisplayName("Content-Type формы в верхнем регистре распознаётся при любой локали JVM")
  void shouldDetectUppercaseFormContentTypeUnderTurkishLocale() {
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenReturn(true);
    Locale previous = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      handler.channelRead0(ctx, post("/push", "devId=gw_tr&type=100", "APPLICATION/X-WWW-FORM-URLENCODED"));
    } finally {
      Locale.setDefault(previous);
    }

    ArgumentCaptor<GatewayEvent> captor = ArgumentCaptor.forClass(GatewayEvent.class);
    verify(telemetryService).processTelemetry(captor.capture());
    assertThat(captor.getValue().getDevId()).isEqualTo("gw_tr");
    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.OK);
  }

  @Test
  @DisplayName("POST /push-form → form-тело с URL-декодированием")
  void shouldDecodePushForm() {
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenReturn(true);

    handler.channelRead0(ctx, post("/push-form", "devId=gw_03&type=501&smsBd=hi%20there&phNum=%2B86100",
        "text/plain"));

    ArgumentCaptor<GatewayEvent> captor = ArgumentCaptor.forClass(GatewayEvent.class);
    verify(telemetryService).processTelemetry(captor.capture());
    assertThat(captor.getValue().getString("smsBd")).isEqualTo("hi there");
    assertThat(captor.getValue().getString("phNum")).isEqualTo("+86100");
  }

  @Test
  @DisplayName("GET /push → параметры из query-строки")
  void shouldDecodeQueryOnGetPush() {
    when(telemetryService.processTelemetry(any(GatewayEvent.class))).thenReturn(true);
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1, HttpMethod.GET, "/push?devId=gw_04&type=998");

    handler.channelRead0(ctx, request);

    ArgumentCaptor<GatewayEvent> captor = ArgumentCaptor.forClass(GatewayEvent.class);
    verify(telemetryService).processTelemetry(captor.capture());
    assertThat(captor.getValue().getDevId()).isEqualTo("gw_04");
    assertThat(captor.getValue().getType()).isEqualTo(998);
    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.OK);
  }

  @Test
  @DisplayName("Неизвестный путь → 404")
  void shouldReturn404ForUnknownPath() {
    handler.channelRead0(ctx, post("/telemetry", "{}", "application/json"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).isEqualTo("{\"error\":\"404\"}");
    verifyNoInteractions(telemetryService);
  }
}
