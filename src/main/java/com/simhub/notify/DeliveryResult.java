package com.simhub.notify;

/**
 * Итог доставки одного события в один канал.
 */
public final class DeliveryResult {

  private final String channel;
  private final boolean success;
  private final String error;

  private DeliveryResult(String channel, boolean success, String error) {
    this.channel = channel;
    this.success = success;
    this.error = error;
  }

  public static DeliveryResult success(String channel) {
    return new DeliveryResult(channel, true, null);
  }

  public static DeliveryResult failure(String channel, String error) {
    return new DeliveryResult(channel, false, error);
  }

  public String getChannel() {
    return channel;
  }

  public boolean isSuccess() {
    return success;
  }

  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return success ? channel + ": ok" : channel + ": " + error;
  }
}
