package com.simhub.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simhub.codec.GatewayEvent;
import com.simhub.codec.IngestException;
import com.simhub.codec.PayloadDecoder;
import com.simhub.service.TelemetryService;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Обработчик HTTP-запросов для приёма push-сообщений от шлюзов.
 * <p>
 * Маршруты:
 * <ul>
 *   <li>{@code POST /push}: JSON-тело (или form-тело, если так указан Content-Type);</li>
 *   <li>{@code POST /push-form}: form-тело;</li>
 *   <li>{@code GET /push}: параметры в query-строке.</li>
 * </ul>
 * Декодирование делегируется {@link PayloadDecoder}, обработка в {@link TelemetryService}.
 */
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  private static final ObjectMapper JSON = new ObjectMapper();

  private final PayloadDecoder payloadDecoder;
  private final TelemetryService telemetryService;

  /**
   * Конструктор обработчика.
   *
   * @param payloadDecoder Декодер входящих сообщений.
   * @param telemetryService Сервис для обработки сообщений.
   */
  public HttpServerHandler(PayloadDecoder payloadDecoder, TelemetryService telemetryService) {
    this.payloadDecoder = payloadDecoder;
    this.telemetryService = telemetryService;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    QueryStringDecoder query = new QueryStringDecoder(request.uri());
    String path = query.path();
    HttpMethod method = request.method();
    logger.debug("📥 {} {}", method, path);

    FullHttpResponse response;

    if (method == HttpMethod.POST && "/push".equals(path)) {
      String body = request.content().toString(CharsetUtil.UTF_8);
      response = ingest(() -> isForm(request) ? payloadDecoder.decodeForm(body) : payloadDecoder.decodeJson(body));
    } else if (method == HttpMethod.POST && "/push-form".equals(path)) {
      String body = request.content().toString(CharsetUtil.UTF_8);
      response = ingest(() -> payloadDecoder.decodeForm(body));
    } else if (method == HttpMethod.GET && "/push".equals(path)) {
      response = ingest(() -> payloadDecoder.decodeQuery(query.parameters()));
    } else {
      response = createJsonResponse(HttpResponseStatus.NOT_FOUND, "{\"error\":\"404\"}");
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse ingest(Supplier<GatewayEvent> decoding) {
    try {
      GatewayEvent event = decoding.get();
      boolean success = telemetryService.processTelemetry(event);
      if (success) {
        return createJsonResponse(HttpResponseStatus.OK, result(0, "OK"));
      }
      return createJsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, result(-1, "Processing failed"));
    } catch (IngestException e) {
      logger.warn("⚠️ Сообщение отклонено: {}", e.getMessage());
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, result(-1, e.getMessage()));
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка обработки сообщения", e);
      return createJsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, result(-1, "Processing failed"));
    }
  }

  private static boolean isForm(FullHttpRequest request) {
    String contentType = request.headers().get(HttpHeaderNames.CONTENT_TYPE);
    return contentType != null
        && contentType.toLowerCase(Locale.ROOT).startsWith(HttpHeaderValues.APPLICATION_X_WWW_FORM_URLENCODED.toString());
  }

  private static String result(int code, String message) {
    ObjectNode node = JSON.createObjectNode();
    node.put("code", code);
    node.put("message", message);
    return node.toString();
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, String body) {
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("❌ Ошибка канала", cause);
    ctx.close();
  }
}
