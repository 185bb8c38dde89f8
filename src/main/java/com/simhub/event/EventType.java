package com.simhub.event;

import java.util.Objects;

/**
 * Результат классификации кода сообщения: категория и человекочитаемая метка.
 */
public final class EventType {

  private final int code;
  private final EventCategory category;
  private final String label;

  public EventType(int code, EventCategory category, String label) {
    this.code = code;
    this.category = category;
    this.label = label;
  }

  public int getCode() {
    return code;
  }

  public EventCategory getCategory() {
    return category;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EventType)) {
      return false;
    }
    EventType that = (EventType) o;
    return code == that.code && category == that.category && label.equals(that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, category, label);
  }

  @Override
  public String toString() {
    return code + " " + category.wireName() + " (" + label + ")";
  }
}
