package com.drillsite.api;

import com.drillsite.model.Hole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Реализация {@link HolesApi} поверх {@link HttpClient}.
 * <p>
 * {@code baseUrl} уже включает префикс {@code /api}, например {@code https://example.org/api}.
 */
public class HttpHolesApiClient implements HolesApi {

  private static final Logger logger = LoggerFactory.getLogger(HttpHolesApiClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String baseUrl;
  private final Duration timeout;

  /**
   * Конструктор клиента.
   *
   * @param httpClient HTTP-клиент.
   * @param baseUrl    Базовый URL API (с {@code /api}).
   * @param timeout    Таймаут одного запроса.
   */
  public HttpHolesApiClient(HttpClient httpClient, String baseUrl, Duration timeout) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("API base URL cannot be empty");
    }
    this.httpClient = httpClient;
    this.objectMapper = new ObjectMapper();
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.timeout = timeout;
  }

  @Override
  public List<Hole> fetchHoles(long projectId) throws HolesApiException {
    String url = baseUrl + "/projects/" + projectId + "/holes";
    HttpRequest request = newRequest(url).GET().build();

    JsonNode body = send(request, url);
    JsonNode holes = body.get("holes");
    if (holes == null || !holes.isArray()) {
      throw new HolesApiException("В ответе " + url + " нет массива 'holes'");
    }
    List<Hole> result = HoleJsonMapper.toHoles(holes);
    logger.debug("Получено {} скважин проекта {}", result.size(), projectId);
    return result;
  }

  @Override
  public void postDrillingSpeed(long projectId, String holeId, DrillingSpeedReport report)
      throws HolesApiException {
    String url = baseUrl + "/projects/" + projectId + "/holes/" + encodePathSegment(holeId) + "/drilling-speed";

    String jsonBody;
    try {
      jsonBody = objectMapper.writeValueAsString(report);
    } catch (JsonProcessingException e) {
      throw new HolesApiException("Не удалось сериализовать " + report, e);
    }

    HttpRequest request = newRequest(url)
        .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
        .build();
    send(request, url);
  }

  private HttpRequest.Builder newRequest(String url) {
    return HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .timeout(timeout);
  }

  /**
   * Выполняет запрос и проверяет ответ: статус 2xx, JSON-объект, {@code "success": true}.
   */
  private JsonNode send(HttpRequest request, String url) throws HolesApiException {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new HolesApiException("API недоступен: " + request.method() + " " + url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HolesApiException("Запрос прерван: " + request.method() + " " + url, e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new HolesApiException(
          "API вернул ошибку " + status + " на " + request.method() + " " + url + ": " + response.body(),
          status, null);
    }

    JsonNode body;
    try {
      body = objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new HolesApiException("Некорректный JSON в ответе " + url, status, e);
    }
    if (body == null || !body.isObject()) {
      throw new HolesApiException("Ответ " + url + " не является JSON-объектом", status, null);
    }
    if (!body.path("success").asBoolean(false)) {
      throw new HolesApiException("API не подтвердил операцию " + request.method() + " " + url + ": " + body,
          status, null);
    }
    return body;
  }

  private static String encodePathSegment(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
