package com.simhub.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simhub.model.ChannelConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Общая часть чат-webhook каналов: POST JSON на URL из настройки {@code webhook}
 * и проверка кода в конверте ответа провайдера.
 */
public abstract class WebhookSender implements ChannelSender {

  protected final ObjectMapper objectMapper;
  private final HttpClient httpClient;
  private final Duration timeout;

  protected WebhookSender(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.timeout = timeout;
  }

  /**
   * Собирает тело запроса для провайдера.
   */
  protected abstract ObjectNode buildPayload(NotificationMessage message);

  /**
   * Проверяет конверт ответа провайдера.
   *
   * @throws NotificationException если провайдер вернул ненулевой код.
   */
  protected abstract void checkResponse(JsonNode response) throws NotificationException;

  @Override
  public void send(ChannelConfig config, NotificationMessage message) throws NotificationException {
    String webhook = config.getString("webhook");
    if (webhook == null) {
      throw new NotificationException("Для канала " + channel() + " не задан webhook");
    }

    String jsonBody;
    try {
      jsonBody = objectMapper.writeValueAsString(buildPayload(message));
    } catch (JsonProcessingException e) {
      throw new NotificationException("Не удалось сериализовать сообщение для " + channel(), e);
    }

    HttpRequest request;
    try {
      request = HttpRequest.newBuilder()
          .uri(URI.create(webhook))
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
          .timeout(timeout)
          .build();
    } catch (IllegalArgumentException e) {
      throw new NotificationException("Некорректный webhook канала " + channel() + ": " + webhook, e);
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new NotificationException("Канал " + channel() + " недоступен: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NotificationException("Отправка в канал " + channel() + " прервана", e);
    }

    if (response.statusCode() >= 400) {
      throw new NotificationException(channel() + " вернул HTTP " + response.statusCode());
    }
    JsonNode envelope;
    try {
      envelope = objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new NotificationException(channel() + " вернул не-JSON ответ", e);
    }
    checkResponse(envelope == null ? objectMapper.createObjectNode() : envelope);
  }
}
