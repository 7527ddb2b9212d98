package com.drillsite.gnss;

import com.drillsite.model.PositionFix;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Разбор входящих сообщений о положении от GNSS-приёмника.
 * <p>
 * Поддерживаются два вида сообщений, проверяемые по порядку:
 * <ol>
 *   <li>NMEA-предложение GGA с любым префиксом созвездия ($GPGGA, $GNGGA, $GLGGA, $GAGGA, $BDGGA);</li>
 *   <li>JSON-объект, разбираемый по таблице {@link CoordinateLayout#DEFAULT_LAYOUTS}.</li>
 * </ol>
 * Ошибки разбора не выбрасываются: результатом будет {@link Optional#empty()}.
 */
public class PositionMessageParser {

  private static final Logger logger = LoggerFactory.getLogger(PositionMessageParser.class);

  private static final int GGA_MIN_FIELDS = 10;
  private static final int LOG_PAYLOAD_LIMIT = 200;

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final List<CoordinateLayout> layouts;

  public PositionMessageParser() {
    this(new ObjectMapper(), Clock.systemUTC());
  }

  public PositionMessageParser(ObjectMapper objectMapper, Clock clock) {
    this(objectMapper, clock, CoordinateLayout.DEFAULT_LAYOUTS);
  }

  public PositionMessageParser(ObjectMapper objectMapper, Clock clock, List<CoordinateLayout> layouts) {
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.layouts = List.copyOf(layouts);
  }

  /**
   * Разбирает текстовое сообщение: сначала как NMEA GGA, затем как JSON.
   *
   * @param payload Текст сообщения в UTF-8.
   * @return Положение или пусто, если координаты не найдены.
   */
  public Optional<PositionFix> parse(String payload) {
    if (payload == null) {
      return Optional.empty();
    }
    String text = payload.strip();

    if (isGgaSentence(text)) {
      Optional<PositionFix> fix = parseGgaSentence(text);
      if (fix.isPresent()) {
        return fix;
      }
    }

    JsonNode json = readJson(text);
    if (json != null) {
      return parse(json);
    }

    logger.debug("Координаты не найдены в сообщении: {}", abbreviate(text));
    return Optional.empty();
  }

  /**
   * Разбирает уже декодированный JSON-объект.
   */
  public Optional<PositionFix> parse(JsonNode message) {
    if (message == null || !message.isObject()) {
      logger.debug("Сообщение не является JSON-объектом: {}", message);
      return Optional.empty();
    }
    for (CoordinateLayout layout : layouts) {
      Optional<CoordinateLayout.Coordinates> found = layout.extract(message);
      if (found.isPresent()) {
        CoordinateLayout.Coordinates c = found.get();
        return Optional.of(new PositionFix(c.latitude, c.longitude, c.elevation, clock.instant()));
      }
    }
    logger.debug("Координаты не найдены в JSON: {}", abbreviate(message.toString()));
    return Optional.empty();
  }

  static boolean isGgaSentence(String text) {
    return text.startsWith("$") && text.substring(0, Math.min(7, text.length())).contains("GGA");
  }

  /**
   * Разбирает GGA: $xxGGA,time,lat,N|S,lon,E|W,quality,numSV,HDOP,alt,M,...*cs
   * <p>
   * Контрольная сумма не проверяется.
   */
  Optional<PositionFix> parseGgaSentence(String sentence) {
    String[] fields = sentence.split(",", -1);
    if (fields.length < GGA_MIN_FIELDS) {
      logger.debug("GGA отклонено: {} полей вместо минимум {}", fields.length, GGA_MIN_FIELDS);
      return Optional.empty();
    }

    try {
      Double lat = nmeaToDegrees(fields[2]);
      Double lon = nmeaToDegrees(fields[4]);
      String latHemisphere = fields[3].trim();
      String lonHemisphere = fields[5].trim();
      if (lat == null || lon == null || latHemisphere.isEmpty() || lonHemisphere.isEmpty()) {
        logger.debug("GGA без координат: {}", sentence);
        return Optional.empty();
      }
      if ("S".equals(latHemisphere)) {
        lat = -lat;
      }
      if ("W".equals(lonHemisphere)) {
        lon = -lon;
      }

      double altitude;
      try {
        altitude = Double.parseDouble(fields[9].trim());
      } catch (NumberFormatException e) {
        altitude = 0.0;
      }

      return Optional.of(new PositionFix(lat, lon, altitude, clock.instant()));
    } catch (NumberFormatException e) {
      logger.debug("Ошибка разбора GGA '{}': {}", sentence, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Переводит (D)DDMM.MMMM в десятичные градусы. Минуты: две цифры перед точкой и дробная часть.
   *
   * @return Градусы или {@code null}, если в значении нет точки или нет цифр градусов перед минутами.
   * @throws NumberFormatException если значение не числовое.
   */
  static Double nmeaToDegrees(String raw) {
    String value = raw.trim();
    int dot = value.indexOf('.');
    if (dot < 2) {
      return null;
    }
    String degreesPart = value.substring(0, dot - 2);
    if (degreesPart.isEmpty()) {
      return null;
    }
    double degrees = Double.parseDouble(degreesPart);
    double minutes = Double.parseDouble(value.substring(dot - 2));
    return degrees + minutes / 60.0;
  }

  private JsonNode readJson(String text) {
    if (text.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private static String abbreviate(String text) {
    return text.length() <= LOG_PAYLOAD_LIMIT ? text : text.substring(0, LOG_PAYLOAD_LIMIT) + "...";
  }
}
