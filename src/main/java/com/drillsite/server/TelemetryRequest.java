package com.drillsite.server;

/**
 * Отсчёт лазерного датчика, принятый по HTTP.
 * Используется для десериализации JSON-запроса.
 */
public class TelemetryRequest {

  private Double velocity;
  private Double depth;
  private String timestamp;

  /**
   * Конструктор по умолчанию. Обязателен для работы с Jackson.
   */
  public TelemetryRequest() {}

  public TelemetryRequest(Double velocity, Double depth, String timestamp) {
    this.velocity = velocity;
    this.depth = depth;
    this.timestamp = timestamp;
  }

  /**
   * @return Скорость бурения, м/с.
   */
  public Double getVelocity() {
    return velocity;
  }

  public void setVelocity(Double velocity) {
    this.velocity = velocity;
  }

  /**
   * @return Глубина, м.
   */
  public Double getDepth() {
    return depth;
  }

  public void setDepth(Double depth) {
    this.depth = depth;
  }

  /**
   * @return Время измерения в ISO-8601 (например "2024-05-01T10:15:30Z") или {@code null}.
   */
  public String getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(String timestamp) {
    this.timestamp = timestamp;
  }
}
