package com.simhub.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simhub.model.ChannelConfig;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Бот Feishu: интерактивная карточка с заголовком и markdown-телом.
 * Успех: {@code code == 0} в ответе.
 */
public class FeishuSender extends WebhookSender {

  public FeishuSender(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
    super(httpClient, objectMapper, timeout);
  }

  @Override
  public String channel() {
    return ChannelConfig.FEISHU;
  }

  @Override
  protected ObjectNode buildPayload(NotificationMessage message) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("msg_type", "interactive");
    ObjectNode card = payload.putObject("card");
    ObjectNode header = card.putObject("header");
    header.putObject("title")
        .put("tag", "plain_text")
        .put("content", message.getTitle());
    header.put("template", "blue");
    card.putArray("elements")
        .addObject()
        .put("tag", "div")
        .putObject("text")
        .put("tag", "lark_md")
        .put("content", message.getMarkdown());
    return payload;
  }

  @Override
  protected void checkResponse(JsonNode response) throws NotificationException {
    int code = response.path("code").asInt(-1);
    if (code != 0) {
      throw new NotificationException("Feishu code=" + code + ": " + response.path("msg").asText());
    }
  }
}
