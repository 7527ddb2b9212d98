package com.drillsite.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Одно GNSS-наблюдение: координаты, необязательная высота и момент получения.
 * <p>
 * Создаётся парсером на каждое входящее сообщение, дальше не изменяется.
 */
public final class PositionFix {

  private final double latitude;
  private final double longitude;
  private final Double elevation;
  private final Instant receivedAt;

  /**
   * @param latitude   Широта в градусах.
   * @param longitude  Долгота в градусах.
   * @param elevation  Высота в метрах или {@code null}, если неизвестна.
   * @param receivedAt Момент получения сообщения.
   */
  public PositionFix(double latitude, double longitude, Double elevation, Instant receivedAt) {
    this.latitude = latitude;
    this.longitude = longitude;
    this.elevation = elevation;
    this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
  }

  public double getLatitude() {
    return latitude;
  }

  public double getLongitude() {
    return longitude;
  }

  /**
   * @return Высота в метрах или {@code null}.
   */
  public Double getElevation() {
    return elevation;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PositionFix)) {
      return false;
    }
    PositionFix that = (PositionFix) o;
    return Double.compare(latitude, that.latitude) == 0
        && Double.compare(longitude, that.longitude) == 0
        && Objects.equals(elevation, that.elevation)
        && receivedAt.equals(that.receivedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(latitude, longitude, elevation, receivedAt);
  }

  @Override
  public String toString() {
    return "PositionFix{lat=" + latitude + ", lon=" + longitude
        + ", elevation=" + elevation + ", receivedAt=" + receivedAt + '}';
  }
}
