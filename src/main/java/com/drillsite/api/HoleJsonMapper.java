package com.drillsite.api;

import com.drillsite.model.Hole;
import com.drillsite.util.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Преобразует элементы массива {@code holes} из ответа API в {@link Hole}.
 * <p>
 * API отдаёт идентификатор как {@code hole_id} или {@code id}, а координаты либо плоско
 * ({@code gps_lat}, {@code gps_lon}, {@code gps_elevation}), либо во вложенном объекте {@code gps}.
 */
final class HoleJsonMapper {

  private static final Logger logger = LoggerFactory.getLogger(HoleJsonMapper.class);

  static List<Hole> toHoles(JsonNode holesArray) {
    List<Hole> holes = new ArrayList<>(holesArray.size());
    for (JsonNode node : holesArray) {
      Hole hole = toHole(node);
      if (hole != null) {
        holes.add(hole);
      }
    }
    return holes;
  }

  static Hole toHole(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    String id = JsonValues.asText(node.get("hole_id"));
    if (id == null) {
      id = JsonValues.asText(node.get("id"));
    }
    if (id == null) {
      logger.warn("Скважина без идентификатора пропущена: {}", node);
      return null;
    }

    JsonNode gps = node.get("gps");
    return new Hole(
        id,
        coordinate(node, "gps_lat", gps, "lat"),
        coordinate(node, "gps_lon", gps, "lon"),
        coordinate(node, "gps_elevation", gps, "elevation"),
        JsonValues.asText(node.get("name"))
    );
  }

  private static Double coordinate(JsonNode node, String flatKey, JsonNode gps, String nestedKey) {
    Double value = JsonValues.asDouble(node.get(flatKey));
    if (value == null && gps != null && gps.isObject()) {
      value = JsonValues.asDouble(gps.get(nestedKey));
    }
    return value;
  }

  private HoleJsonMapper() {
    throw new UnsupportedOperationException("Utility class");
  }
}
