package com.drillsite.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Нестрогое чтение значений из JSON, присылаемого устройствами и API.
 */
public final class JsonValues {

  /**
   * Читает число из числового или строкового узла.
   *
   * @return Конечное число или {@code null}, если узла нет, он пустой или не числовой.
   */
  public static Double asDouble(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    double value;
    if (node.isNumber()) {
      value = node.doubleValue();
    } else if (node.isTextual()) {
      try {
        value = Double.parseDouble(node.textValue().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    } else {
      return null;
    }
    return Double.isFinite(value) ? value : null;
  }

  /**
   * Читает непустую строку; числа приводятся к тексту (id может прийти как 17 или "HK_01").
   */
  public static String asText(JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    String text = node.asText().trim();
    return text.isEmpty() ? null : text;
  }

  private JsonValues() {
    throw new UnsupportedOperationException("Utility class");
  }
}
