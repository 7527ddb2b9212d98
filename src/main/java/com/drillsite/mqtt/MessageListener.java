package com.drillsite.mqtt;

/**
 * Получатель сообщений, пришедших по подписке.
 * <p>
 * Вызывается в сетевом потоке транспорта: реализация не должна надолго его блокировать.
 */
@FunctionalInterface
public interface MessageListener {

  /**
   * @param topic   Топик, в который опубликовано сообщение (например, "device/rtk-01/upload").
   * @param payload Тело сообщения, декодированное как UTF-8.
   */
  void onMessage(String topic, String payload);
}
