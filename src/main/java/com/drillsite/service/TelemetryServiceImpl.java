package com.drillsite.service;

import com.drillsite.model.TelemetrySample;
import com.drillsite.server.TelemetryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Реализация сервиса приёма телеметрии.
 */
public class TelemetryServiceImpl implements TelemetryService {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryServiceImpl.class);

  private final TelemetryCoalescingQueue queue;
  private final PositionCorrelationService correlationService;
  private final Clock clock;

  /**
   * Конструктор сервиса.
   *
   * @param queue              Очередь доставки скорости бурения.
   * @param correlationService Сервис сопоставления положений, получает текущие показания.
   */
  public TelemetryServiceImpl(TelemetryCoalescingQueue queue, PositionCorrelationService correlationService) {
    this(queue, correlationService, Clock.systemUTC());
  }

  public TelemetryServiceImpl(TelemetryCoalescingQueue queue, PositionCorrelationService correlationService,
                              Clock clock) {
    this.queue = queue;
    this.correlationService = correlationService;
    this.clock = clock;
  }

  @Override
  public boolean processTelemetry(TelemetryRequest data) {
    if (data == null) {
      throw new IllegalArgumentException("Telemetry data cannot be null");
    }
    TelemetrySample sample = toSample(data);

    try {
      queue.add(sample);
      correlationService.setDrillingData(sample.getVelocityMetersPerSecond(), sample.getDepthMeters());
      logger.debug("Принят отсчёт: скорость={} м/с, глубина={} м",
          sample.getVelocityMetersPerSecond(), sample.getDepthMeters());
      return true;
    } catch (RuntimeException e) {
      logger.error("❌ Не удалось принять отсчёт телеметрии {}", sample, e);
      return false;
    }
  }

  @Override
  public CorrelationStats getCorrelationStats() {
    return correlationService.getStats();
  }

  @Override
  public DeliveryStats getDeliveryStats() {
    return queue.getStats();
  }

  private TelemetrySample toSample(TelemetryRequest data) {
    Double velocity = data.getVelocity();
    Double depth = data.getDepth();
    if (velocity == null || !Double.isFinite(velocity)) {
      throw new IllegalArgumentException("velocity is required and must be finite");
    }
    if (depth == null || !Double.isFinite(depth)) {
      throw new IllegalArgumentException("depth is required and must be finite");
    }

    Instant capturedAt;
    if (data.getTimestamp() == null || data.getTimestamp().isBlank()) {
      capturedAt = clock.instant();
    } else {
      try {
        capturedAt = Instant.parse(data.getTimestamp().trim());
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("timestamp must be ISO-8601: " + data.getTimestamp(), e);
      }
    }
    return new TelemetrySample(velocity, depth, capturedAt);
  }
}
