package com.drillsite.server;

import com.drillsite.model.PositionFix;
import com.drillsite.service.CorrelationStats;
import com.drillsite.service.DeliveryStats;
import com.drillsite.service.TelemetryService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Модульные тесты для HttpServerHandler.
 * <p>
 * Проверяют HTTP-уровень: парсинг запроса, валидацию, формирование ответа.
 * Сервис телеметрии замокан, но проверяется, что в него передаются корректные данные.
 */
class HttpServerHandlerTest {

  @Mock
  private TelemetryService telemetryService;

  @Mock
  private ChannelHandlerContext ctx;

  @Mock
  private ChannelPromise channelPromise;

  private HttpServerHandler handler;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    handler = new HttpServerHandler(telemetryService);

    // Настраиваем моки так, чтобы ctx.writeAndFlush не падал
    when(ctx.writeAndFlush(any())).thenReturn(channelPromise);
    when(channelPromise.addListener(any())).thenReturn(channelPromise);
  }

  private static FullHttpRequest post(String uri, String jsonBody) {
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        HttpMethod.POST,
        uri,
        Unpooled.wrappedBuffer(jsonBody.getBytes(StandardCharsets.UTF_8))
    );
    request.headers().set(HttpHeaderNames.CONTENT_LENGTH, jsonBody.length());
    request.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
    return request;
  }

  private FullHttpResponse captureResponse() {
    ArgumentCaptor<FullHttpResponse> responseCaptor = ArgumentCaptor.forClass(FullHttpResponse.class);
    verify(ctx).writeAndFlush(responseCaptor.capture());
    return responseCaptor.getValue();
  }

  @Test
  @DisplayName("Валидный POST /telemetry → вызывает service с корректными данными")
  void shouldParseValidJsonAndPassToService() {
    // Given
    String jsonBody = "{\"velocity\":0.42,\"depth\":15.5,\"timestamp\":\"2024-05-01T10:15:30Z\"}";

    // When
    handler.channelRead0(ctx, post("/telemetry", jsonBody));

    // Then: проверяем, что service вызван с правильным объектом
    ArgumentCaptor<TelemetryRequest> captor = ArgumentCaptor.forClass(TelemetryRequest.class);
    verify(telemetryService).processTelemetry(captor.capture());

    TelemetryRequest data = captor.getValue();
    assertThat(data.getVelocity()).isEqualTo(0.42);
    assertThat(data.getDepth()).isEqualTo(15.5);
    assertThat(data.getTimestamp()).isEqualTo("2024-05-01T10:15:30Z");
  }

  @Test
  @DisplayName("Валидный запрос + service вернул true → 200 OK")
  void shouldReturn200WhenServiceReturnsTrue() {
    when(telemetryService.processTelemetry(any(TelemetryRequest.class))).thenReturn(true);

    handler.channelRead0(ctx, post("/telemetry", "{\"velocity\":0.42,\"depth\":15.5}"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"status\":\"accepted\"");
  }

  @Test
  @DisplayName("Валидный запрос + service вернул false → 500 Internal Server Error")
  void shouldReturn500WhenServiceReturnsFalse() {
    when(telemetryService.processTelemetry(any(TelemetryRequest.class))).thenReturn(false);

    handler.channelRead0(ctx, post("/telemetry", "{\"velocity\":0.42,\"depth\":15.5}"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"error\":\"Processing failed\"");
  }

  @Test
  @DisplayName("Невалидный JSON → 400 Bad Request, сервис не вызывается")
  void shouldReturn400WhenJsonIsInvalid() {
    handler.channelRead0(ctx, post("/telemetry", "{invalid"));

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"error\":\"Invalid telemetry\"");
    verifyNoInteractions(telemetryService);
  }

  @Test
  @DisplayName("Сервис отклонил данные (IllegalArgumentException) → 400 Bad Request")
  void shouldReturn400WhenServiceRejectsData() {
    when(telemetryService.processTelemetry(any(TelemetryRequest.class)))
        .thenThrow(new IllegalArgumentException("depth is required"));

    handler.channelRead0(ctx, post("/telemetry", "{\"velocity\":0.42}"));

    assertThat(captureResponse().status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
  }

  @Test
  @DisplayName("GET /stats → счётчики сопоставления и доставки")
  void shouldReturnStats() throws Exception {
    Instant updated = Instant.parse("2024-05-01T10:15:30Z");
    when(telemetryService.getCorrelationStats()).thenReturn(new CorrelationStats(10, 8, 3, 1, updated,
        new PositionFix(21.0285, 105.8542, null, updated)));
    when(telemetryService.getDeliveryStats()).thenReturn(new DeliveryStats(5, 2, null));
    FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/stats");

    handler.channelRead0(ctx, request);

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    JsonNode json = new ObjectMapper().readTree(response.content().toString(StandardCharsets.UTF_8));
    assertThat(json.at("/correlation/messagesReceived").asLong()).isEqualTo(10);
    assertThat(json.at("/correlation/holesUpdated").asLong()).isEqualTo(3);
    assertThat(json.at("/correlation/lastUpdateTimestamp").asText()).isEqualTo("2024-05-01T10:15:30Z");
    assertThat(json.at("/correlation/lastPosition/lat").asDouble()).isEqualTo(21.0285);
    assertThat(json.at("/correlation/lastPosition/elevation").isNull()).isTrue();
    assertThat(json.at("/delivery/sent").asLong()).isEqualTo(5);
    assertThat(json.at("/delivery/failed").asLong()).isEqualTo(2);
    assertThat(json.at("/delivery/lastSendTimestamp").isNull()).isTrue();
  }

  @Test
  @DisplayName("Неверный URI → 404 Not Found")
  void shouldReturn404ForUnknownPath() {
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        HttpMethod.POST,
        "/unknown",
        Unpooled.EMPTY_BUFFER
    );

    handler.channelRead0(ctx, request);

    FullHttpResponse response = captureResponse();
    assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
    assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("\"error\":\"404\"");
  }
}
