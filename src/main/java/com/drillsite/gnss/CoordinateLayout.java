package com.drillsite.gnss;

import com.drillsite.util.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Правило извлечения координат из JSON-сообщения.
 * <p>
 * Правило указывает путь до объекта с координатами (пустой путь означает корень сообщения)
 * и списки допустимых имён ключей. Внутри каждого списка побеждает первый найденный ключ.
 * Правила проверяются в порядке {@link #DEFAULT_LAYOUTS}; первое полное совпадение
 * (есть и широта, и долгота) даёт результат.
 */
public final class CoordinateLayout {

  static final List<String> LATITUDE_KEYS = List.of("lat", "latitude", "gps_lat");
  static final List<String> LONGITUDE_KEYS = List.of("lon", "longitude", "gps_lon");
  static final List<String> ELEVATION_KEYS = List.of("elevation", "alt", "gps_elevation");

  /**
   * Поддерживаемые схемы сообщений по убыванию приоритета.
   * Новая схема добавляется строкой в этот список.
   */
  public static final List<CoordinateLayout> DEFAULT_LAYOUTS = List.of(
      new CoordinateLayout(List.of()),
      new CoordinateLayout(List.of("gps")),
      new CoordinateLayout(List.of("location")),
      new CoordinateLayout(List.of("gnss"))
  );

  private final List<String> containerPath;

  public CoordinateLayout(List<String> containerPath) {
    this.containerPath = List.copyOf(containerPath);
  }

  public List<String> getContainerPath() {
    return containerPath;
  }

  /**
   * Пытается извлечь координаты по этому правилу.
   *
   * @param root Корень JSON-сообщения.
   * @return Координаты, если найдены и широта, и долгота.
   */
  Optional<Coordinates> extract(JsonNode root) {
    JsonNode container = root;
    for (String segment : containerPath) {
      container = container.get(segment);
      if (container == null || !container.isObject()) {
        return Optional.empty();
      }
    }
    if (!container.isObject()) {
      return Optional.empty();
    }

    Double lat = firstNumeric(container, LATITUDE_KEYS);
    Double lon = firstNumeric(container, LONGITUDE_KEYS);
    if (lat == null || lon == null) {
      return Optional.empty();
    }
    return Optional.of(new Coordinates(lat, lon, firstNumeric(container, ELEVATION_KEYS)));
  }

  private static Double firstNumeric(JsonNode container, List<String> keys) {
    for (String key : keys) {
      Double value = JsonValues.asDouble(container.get(key));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return containerPath.isEmpty() ? "<root>" : String.join(".", containerPath);
  }

  /** Координаты, извлечённые одним правилом. */
  static final class Coordinates {
    final double latitude;
    final double longitude;
    final Double elevation;

    Coordinates(double latitude, double longitude, Double elevation) {
      this.latitude = latitude;
      this.longitude = longitude;
      this.elevation = elevation;
    }
  }
}
