package com.simhub.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simhub.model.ChannelConfig;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Групповой бот WeCom: простое текстовое сообщение.
 * Успех: {@code errcode == 0} в ответе.
 */
public class WeComSender extends WebhookSender {

  public WeComSender(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
    super(httpClient, objectMapper, timeout);
  }

  @Override
  public String channel() {
    return ChannelConfig.WECOM;
  }

  @Override
  protected ObjectNode buildPayload(NotificationMessage message) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("msgtype", "text");
    payload.putObject("text").put("content", message.getTitle() + "\n" + message.getContent());
    return payload;
  }

  @Override
  protected void checkResponse(JsonNode response) throws NotificationException {
    int code = response.path("errcode").asInt(-1);
    if (code != 0) {
      throw new NotificationException("WeCom errcode=" + code + ": " + response.path("errmsg").asText());
    }
  }
}
