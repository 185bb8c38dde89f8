package com.simhub.notify;

/**
 * Отформатированное уведомление: общий заголовок и текст плюс разметка
 * для чатов (markdown) и почты (HTML).
 */
public final class NotificationMessage {

  private final String title;
  private final String content;
  private final String markdown;
  private final String html;

  public NotificationMessage(String title, String content, String markdown, String html) {
    this.title = title;
    this.content = content;
    this.markdown = markdown;
    this.html = html;
  }

  public String getTitle() {
    return title;
  }

  /**
   * @return Текст без разметки.
   */
  public String getContent() {
    return content;
  }

  public String getMarkdown() {
    return markdown;
  }

  public String getHtml() {
    return html;
  }
}
