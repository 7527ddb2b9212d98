package com.drillsite.geo;

import com.drillsite.model.Hole;

import java.util.Optional;

/**
 * Результат поиска ближайшей скважины: сама скважина (если нашлась) и расстояние до неё.
 */
public final class HoleMatch {

  private static final HoleMatch NONE = new HoleMatch(null, Double.POSITIVE_INFINITY);

  private final Hole hole;
  private final double distanceMeters;

  HoleMatch(Hole hole, double distanceMeters) {
    this.hole = hole;
    this.distanceMeters = distanceMeters;
  }

  /**
   * @return Пустой результат с расстоянием +∞.
   */
  public static HoleMatch none() {
    return NONE;
  }

  public Optional<Hole> getHole() {
    return Optional.ofNullable(hole);
  }

  public double getDistanceMeters() {
    return distanceMeters;
  }

  /**
   * Проверка дистанционного порога: совпадение пригодно, только если {@code distance <= maxDistanceMeters}.
   */
  public boolean isWithin(double maxDistanceMeters) {
    return hole != null && distanceMeters <= maxDistanceMeters;
  }

  @Override
  public String toString() {
    return hole == null
        ? "HoleMatch{none}"
        : "HoleMatch{" + hole.getExternalId() + ", " + GeoMath.formatDistance(distanceMeters) + '}';
  }
}
