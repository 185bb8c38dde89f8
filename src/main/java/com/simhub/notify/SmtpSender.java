package com.simhub.notify;

import com.simhub.model.ChannelConfig;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

import java.time.Duration;
import java.util.Properties;

/**
 * Уведомления по почте (SMTP) с текстовой и HTML-частью.
 * <p>
 * Настройки канала: host, port (по умолчанию 465), secure (SSL, по умолчанию true;
 * иначе STARTTLS), user, pass, from (по умолчанию user), to.
 */
public class SmtpSender implements ChannelSender {

  static final String SUBJECT_PREFIX = "[IoT] ";

  private final Duration timeout;

  public SmtpSender(Duration timeout) {
    this.timeout = timeout;
  }

  @Override
  public String channel() {
    return ChannelConfig.SMTP;
  }

  @Override
  public void send(ChannelConfig config, NotificationMessage message) throws NotificationException {
    MimeMessage mail = buildMessage(config, message);
    try {
      Transport.send(mail);
    } catch (MessagingException e) {
      throw new NotificationException("SMTP-отправка не удалась: " + e.getMessage(), e);
    }
  }

  MimeMessage buildMessage(ChannelConfig config, NotificationMessage message) throws NotificationException {
    String host = config.getString("host");
    String user = config.getString("user");
    String pass = config.getString("pass");
    if (host == null || user == null || pass == null) {
      throw new NotificationException("SMTP не настроен: нужны host, user и pass");
    }
    String to = config.getString("to") != null ? config.getString("to") : user;
    String from = config.getString("from") != null ? config.getString("from") : user;
    boolean secure = !"false".equalsIgnoreCase(config.getString("secure"));

    int port;
    try {
      port = config.getString("port") == null ? 465 : Integer.parseInt(config.getString("port"));
    } catch (NumberFormatException e) {
      throw new NotificationException("Некорректный SMTP-порт: " + config.getString("port"), e);
    }

    Properties props = new Properties();
    props.put("mail.smtp.host", host);
    props.put("mail.smtp.port", String.valueOf(port));
    props.put("mail.smtp.auth", "true");
    if (secure) {
      props.put("mail.smtp.ssl.enable", "true");
    } else {
      props.put("mail.smtp.starttls.enable", "true");
    }
    String millis = String.valueOf(timeout.toMillis());
    props.put("mail.smtp.connectiontimeout", millis);
    props.put("mail.smtp.timeout", millis);
    props.put("mail.smtp.writetimeout", millis);

    Session session = Session.getInstance(props, new Authenticator() {
      @Override
      protected PasswordAuthentication getPasswordAuthentication() {
        return new PasswordAuthentication(user, pass);
      }
    });

    try {
      MimeMessage mail = new MimeMessage(session);
      mail.setFrom(new InternetAddress(from));
      mail.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
      mail.setSubject(SUBJECT_PREFIX + message.getTitle(), "UTF-8");

      MimeBodyPart text = new MimeBodyPart();
      text.setText(message.getContent(), "UTF-8");
      MimeBodyPart html = new MimeBodyPart();
      html.setContent(message.getHtml(), "text/html; charset=UTF-8");
      MimeMultipart body = new MimeMultipart("alternative");
      body.addBodyPart(text);
      body.addBodyPart(html);
      mail.setContent(body);
      return mail;
    } catch (MessagingException e) {
      throw new NotificationException("Не удалось сформировать письмо: " + e.getMessage(), e);
    }
  }
}
