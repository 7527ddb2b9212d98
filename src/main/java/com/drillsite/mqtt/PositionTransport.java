package com.drillsite.mqtt;

/**
 * Транспорт публикации/подписки, по которому приходят GNSS-положения.
 */
public interface PositionTransport {

  /**
   * Устанавливает соединение с брокером.
   *
   * @return true, если соединение установлено и брокер его принял.
   */
  boolean connect();

  /**
   * Подписывается на топик; допускаются шаблоны MQTT ("device/+/upload").
   *
   * @return true, если брокер подтвердил подписку.
   */
  boolean subscribe(String topic);

  void unsubscribe(String topic);

  void disconnect();

  boolean isConnected();

  /**
   * Регистрирует получателя сообщений. Повторный вызов заменяет предыдущего, {@code null} отключает доставку.
   */
  void setMessageListener(MessageListener listener);
}
