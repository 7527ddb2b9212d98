package com.drillsite.model;

import java.util.Objects;

/**
 * Буровая скважина проекта с координатами, полученными из API.
 * <p>
 * Идентичность определяется {@code externalId}. Координаты могут отсутствовать:
 * такие скважины не участвуют в поиске ближайшей.
 */
public final class Hole {

  private final String externalId;
  private final Double latitude;
  private final Double longitude;
  private final Double elevation;
  private final String name;

  public Hole(String externalId, Double latitude, Double longitude, Double elevation, String name) {
    if (externalId == null || externalId.isBlank()) {
      throw new IllegalArgumentException("Hole externalId cannot be empty");
    }
    this.externalId = externalId;
    this.latitude = latitude;
    this.longitude = longitude;
    this.elevation = elevation;
    this.name = name;
  }

  public String getExternalId() {
    return externalId;
  }

  public Double getLatitude() {
    return latitude;
  }

  public Double getLongitude() {
    return longitude;
  }

  public Double getElevation() {
    return elevation;
  }

  public String getName() {
    return name;
  }

  /**
   * @return true, если заданы и широта, и долгота.
   */
  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Hole)) {
      return false;
    }
    Hole hole = (Hole) o;
    return externalId.equals(hole.externalId)
        && Objects.equals(latitude, hole.latitude)
        && Objects.equals(longitude, hole.longitude)
        && Objects.equals(elevation, hole.elevation)
        && Objects.equals(name, hole.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(externalId, latitude, longitude, elevation, name);
  }

  @Override
  public String toString() {
    return "Hole{" + externalId + (name != null ? " '" + name + "'" : "")
        + ", lat=" + latitude + ", lon=" + longitude + ", elevation=" + elevation + '}';
  }
}
