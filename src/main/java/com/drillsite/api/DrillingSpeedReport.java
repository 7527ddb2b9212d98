package com.drillsite.api;

import com.drillsite.model.TelemetrySample;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Тело запроса POST /projects/{projectId}/holes/{holeId}/drilling-speed.
 * <p>
 * Время всегда в UTC с суффиксом Z и точностью до секунды: "2025-12-03T10:30:00Z".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DrillingSpeedReport {

  static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

  private final double speed;
  private final double depth;
  private final String timestamp;
  private final String sensorId;

  /**
   * @param speed     Скорость бурения, м/с.
   * @param depth     Текущая глубина, м.
   * @param measuredAt Момент измерения.
   * @param sensorId  Идентификатор датчика или {@code null}.
   */
  public DrillingSpeedReport(double speed, double depth, Instant measuredAt, String sensorId) {
    this.speed = speed;
    this.depth = depth;
    this.timestamp = formatTimestamp(measuredAt);
    this.sensorId = sensorId == null || sensorId.isBlank() ? null : sensorId;
  }

  public static DrillingSpeedReport from(TelemetrySample sample, String sensorId) {
    return new DrillingSpeedReport(
        sample.getVelocityMetersPerSecond(), sample.getDepthMeters(), sample.getCapturedAt(), sensorId);
  }

  public static String formatTimestamp(Instant instant) {
    return TIMESTAMP_FORMAT.format(instant);
  }

  public double getSpeed() {
    return speed;
  }

  public double getDepth() {
    return depth;
  }

  public String getTimestamp() {
    return timestamp;
  }

  @JsonProperty("sensor_id")
  public String getSensorId() {
    return sensorId;
  }

  @Override
  public String toString() {
    return "DrillingSpeedReport{speed=" + speed + ", depth=" + depth + ", timestamp=" + timestamp
        + (sensorId != null ? ", sensor_id=" + sensorId : "") + '}';
  }
}
