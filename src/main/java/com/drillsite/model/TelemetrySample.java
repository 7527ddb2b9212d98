package com.drillsite.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Отсчёт телеметрии бурения: мгновенная скорость и глубина.
 */
public final class TelemetrySample {

  private final double velocityMetersPerSecond;
  private final double depthMeters;
  private final Instant capturedAt;

  public TelemetrySample(double velocityMetersPerSecond, double depthMeters, Instant capturedAt) {
    this.velocityMetersPerSecond = velocityMetersPerSecond;
    this.depthMeters = depthMeters;
    this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
  }

  public double getVelocityMetersPerSecond() {
    return velocityMetersPerSecond;
  }

  public double getDepthMeters() {
    return depthMeters;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TelemetrySample)) {
      return false;
    }
    TelemetrySample that = (TelemetrySample) o;
    return Double.compare(velocityMetersPerSecond, that.velocityMetersPerSecond) == 0
        && Double.compare(depthMeters, that.depthMeters) == 0
        && capturedAt.equals(that.capturedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(velocityMetersPerSecond, depthMeters, capturedAt);
  }

  @Override
  public String toString() {
    return "TelemetrySample{velocity=" + velocityMetersPerSecond + " m/s, depth=" + depthMeters
        + " m, capturedAt=" + capturedAt + '}';
  }
}
