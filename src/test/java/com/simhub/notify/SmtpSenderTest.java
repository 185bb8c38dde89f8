package com.simhub.notify;

import com.simhub.model.ChannelConfig;
import jakarta.mail.Message;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SmtpSenderTest {

  private final SmtpSender sender = new SmtpSender(Duration.ofSeconds(7));
  private final NotificationMessage message =
      new NotificationMessage("Phone call", "From: 10010", "**Phone call**", "<h3>Phone call</h3>");

  private static ChannelConfig config(Map<String, Object> settings) {
    return new ChannelConfig(ChannelConfig.SMTP, true, settings, Set.of(), null);
  }

  private static Map<String, Object> baseSettings() {
    Map<String, Object> settings = new LinkedHashMap<>();
    settings.put("host", "smtp.example.com");
    settings.put("user", "bot@example.com");
    settings.put("pass", "secret");
    return settings;
  }

  @Test
  @DisplayName("Письмо: тема с префиксом, текстовая и HTML-части, SSL на 465 по умолчанию")
  void shouldBuildMultipartMessageWithDefaults() throws Exception {
    MimeMessage mail = sender.buildMessage(config(baseSettings()), message);

    assertThat(mail.getSubject()).isEqualTo(SmtpSender.SUBJECT_PREFIX + "Phone call");
    assertThat(mail.getFrom()[0].toString()).isEqualTo("bot@example.com");
    assertThat(mail.getRecipients(Message.RecipientType.TO)[0].toString()).isEqualTo("bot@example.com");
    MimeMultipart body = (MimeMultipart) mail.getContent();
    assertThat(body.getCount()).isEqualTo(2);
    assertThat(body.getBodyPart(0).getContent()).isEqualTo("From: 10010");
    assertThat(body.getBodyPart(1).getContent().toString()).contains("<h3>Phone call</h3>");

    assertThat(mail.getSession().getProperty("mail.smtp.port")).isEqualTo("465");
    assertThat(mail.getSession().getProperty("mail.smtp.ssl.enable")).isEqualTo("true");
    assertThat(mail.getSession().getProperty("mail.smtp.timeout")).isEqualTo("7000");
  }

  @Test
  @DisplayName("secure=false включает STARTTLS, адресаты берутся из настроек")
  void shouldUseStartTlsWhenNotSecure() throws Exception {
    Map<String, Object> settings = baseSettings();
    settings.put("secure", "false");
    settings.put("port", 587);
    settings.put("from", "alerts@example.com");
    settings.put("to", "ops@example.com, oncall@example.com");

    MimeMessage mail = sender.buildMessage(config(settings), message);

    assertThat(mail.getSession().getProperty("mail.smtp.port")).isEqualTo("587");
    assertThat(mail.getSession().getProperty("mail.smtp.starttls.enable")).isEqualTo("true");
    assertThat(mail.getSession().getProperty("mail.smtp.ssl.enable")).isNull();
    assertThat(mail.getFrom()[0].toString()).isEqualTo("alerts@example.com");
    assertThat(mail.getRecipients(Message.RecipientType.TO)).hasSize(2);
  }

  @Test
  @DisplayName("Без host/user/pass канал считается ненастроенным")
  void shouldRejectIncompleteSettings() {
    Map<String, Object> settings = baseSettings();
    settings.remove("pass");

    assertThatThrownBy(() -> sender.buildMessage(config(settings), message))
        .isInstanceOf(NotificationException.class)
        .hasMessageContaining("pass");
  }

  @Test
  @DisplayName("Некорректный порт → NotificationException")
  void shouldRejectInvalidPort() {
    Map<String, Object> settings = baseSettings();
    settings.put("port", "smtp");

    assertThatThrownBy(() -> sender.buildMessage(config(settings), message))
        .isInstanceOf(NotificationException.class);
  }
}
