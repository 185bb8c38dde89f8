package com.simhub.notify;

import com.simhub.service.TimeNormalizer;

import java.util.Map;

/**
 * Превращает доменное событие в текст уведомления.
 */
public class MessageFormatter {

  static final String TEST = "test";

  private final TimeNormalizer timeNormalizer;

  public MessageFormatter(TimeNormalizer timeNormalizer) {
    this.timeNormalizer = timeNormalizer;
  }

  /**
   * @param event Категория события.
   * @param data Данные события.
   * @return Сообщение или {@code null}, если для категории нет шаблона.
   */
  public NotificationMessage format(String event, Map<String, Object> data) {
    String time = timeNormalizer.now();
    String title;
    String[][] lines;
    switch (event) {
      case NotificationService.SMS:
        boolean outgoing = "out".equals(value(data, "direction"));
        title = outgoing ? "SMS sent" : "New SMS";
        lines = new String[][] {
            {outgoing ? "To" : "From", value(data, "phoneNum")},
            {"Content", value(data, "content")},
            {"Device", value(data, "devId") + " / slot " + value(data, "slot")},
            {"Time", value(data, "time")}
        };
        break;
      case NotificationService.CALL:
        title = "Phone call";
        lines = new String[][] {
            {"From", value(data, "phoneNum")},
            {"State", value(data, "callType")},
            {"Device", value(data, "devId") + " / slot " + value(data, "slot")},
            {"Time", value(data, "time")}
        };
        break;
      case NotificationService.DEVICE_STATUS:
        title = "Device status update";
        lines = new String[][] {
            {"Device", value(data, "devId")},
            {"Status", value(data, "status")},
            {"IP", value(data, "ip")},
            {"Time", time}
        };
        break;
      case NotificationService.SIM:
        title = "SIM card update";
        lines = new String[][] {
            {"Device", value(data, "devId") + " / slot " + value(data, "slot")},
            {"Status", value(data, "status")},
            {"ICCID", value(data, "iccid")},
            {"Time", time}
        };
        break;
      case NotificationService.SYSTEM:
        title = "Device system event";
        lines = new String[][] {
            {"Device", value(data, "devId")},
            {"Event", value(data, "status")},
            {"Time", time}
        };
        break;
      case TEST:
        title = "Test notification";
        lines = new String[][] {
            {"Channel", value(data, "channel")},
            {"Time", time}
        };
        break;
      default:
        return null;
    }
    return new NotificationMessage(title, plain(lines), markdown(title, lines), html(title, time, lines));
  }

  private static String plain(String[][] lines) {
    StringBuilder sb = new StringBuilder();
    for (String[] line : lines) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(line[0]).append(": ").append(line[1]);
    }
    return sb.toString();
  }

  private static String markdown(String title, String[][] lines) {
    StringBuilder sb = new StringBuilder("**").append(title).append("**");
    for (String[] line : lines) {
      sb.append("\n> ").append(line[0]).append(": ").append(line[1]);
    }
    return sb.toString();
  }

  private static String html(String title, String time, String[][] lines) {
    StringBuilder sb = new StringBuilder();
    sb.append("<h3>").append(escape(title)).append("</h3>");
    sb.append("<p><strong>Time:</strong> ").append(escape(time)).append("</p>");
    sb.append("<pre style=\"background: #f5f5f5; padding: 10px; border-radius: 5px;\">");
    sb.append(escape(plain(lines)));
    sb.append("</pre>");
    return sb.toString();
  }

  static String escape(String text) {
    return text.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;");
  }

  private static String value(Map<String, Object> data, String key) {
    Object value = data.get(key);
    return value == null ? "" : value.toString();
  }
}
