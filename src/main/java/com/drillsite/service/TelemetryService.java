package com.drillsite.service;

import com.drillsite.server.TelemetryRequest;

/**
 * Сервис приёма телеметрии лазерного датчика.
 * <p>
 * Ставит отсчёты в очередь доставки и передаёт текущие скорость и глубину сервису сопоставления.
 */
public interface TelemetryService {

  /**
   * Принимает отсчёт телеметрии.
   *
   * @param data Объект с данными телеметрии.
   * @return true, если отсчёт принят.
   * @throws IllegalArgumentException если данные отсутствуют или некорректны.
   */
  boolean processTelemetry(TelemetryRequest data);

  CorrelationStats getCorrelationStats();

  DeliveryStats getDeliveryStats();
}
