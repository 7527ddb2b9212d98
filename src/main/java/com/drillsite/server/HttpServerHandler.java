package com.drillsite.server;

import com.drillsite.model.PositionFix;
import com.drillsite.service.CorrelationStats;
import com.drillsite.service.DeliveryStats;
import com.drillsite.service.TelemetryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Обработчик HTTP-запросов: приём телеметрии лазерного датчика и статистика моста.
 * <p>
 * Делегирует обработку данных сервису {@link com.drillsite.service.TelemetryService}.
 */
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TelemetryService telemetryService;

  /**
   * Конструктор обработчика.
   *
   * @param telemetryService Сервис приёма телеметрии.
   */
  public HttpServerHandler(TelemetryService telemetryService) {
    this.telemetryService = telemetryService;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    String uri = request.uri();
    HttpMethod method = request.method();
    logger.debug("📥 {} {}", method, uri);

    FullHttpResponse response;

    if (method == HttpMethod.POST && "/telemetry".equals(uri)) {
      response = handleTelemetry(request);
    } else if (method == HttpMethod.GET && "/stats".equals(uri)) {
      response = createJsonResponse(HttpResponseStatus.OK, statsJson().toString());
    } else {
      response = createJsonResponse(HttpResponseStatus.NOT_FOUND, "{\"error\":\"404\"}");
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse handleTelemetry(FullHttpRequest request) {
    TelemetryRequest data;
    try {
      String body = request.content().toString(CharsetUtil.UTF_8);
      data = MAPPER.readValue(body, TelemetryRequest.class);
    } catch (JsonProcessingException e) {
      logger.warn("Некорректный JSON телеметрии: {}", e.getOriginalMessage());
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, "{\"error\":\"Invalid telemetry\"}");
    }

    try {
      boolean success = telemetryService.processTelemetry(data);
      if (success) {
        return createJsonResponse(HttpResponseStatus.OK, "{\"status\":\"accepted\"}");
      }
      return createJsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"Processing failed\"}");
    } catch (IllegalArgumentException e) {
      logger.warn("Некорректная телеметрия: {}", e.getMessage());
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, "{\"error\":\"Invalid telemetry\"}");
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка при обработке телеметрии", e);
      return createJsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"Processing failed\"}");
    }
  }

  ObjectNode statsJson() {
    ObjectNode root = MAPPER.createObjectNode();

    CorrelationStats correlation = telemetryService.getCorrelationStats();
    ObjectNode c = root.putObject("correlation");
    c.put("messagesReceived", correlation.getMessagesReceived());
    c.put("fixesProcessed", correlation.getFixesProcessed());
    c.put("holesUpdated", correlation.getHolesUpdated());
    c.put("submissionsFailed", correlation.getSubmissionsFailed());
    c.put("lastUpdateTimestamp", isoOrNull(correlation.getLastUpdateTimestamp()));
    PositionFix fix = correlation.getLastFix();
    if (fix == null) {
      c.putNull("lastPosition");
    } else {
      ObjectNode p = c.putObject("lastPosition");
      p.put("lat", fix.getLatitude());
      p.put("lon", fix.getLongitude());
      p.put("elevation", fix.getElevation());
      p.put("receivedAt", isoOrNull(fix.getReceivedAt()));
    }

    DeliveryStats delivery = telemetryService.getDeliveryStats();
    ObjectNode d = root.putObject("delivery");
    d.put("sent", delivery.getSent());
    d.put("failed", delivery.getFailed());
    d.put("lastSendTimestamp", isoOrNull(delivery.getLastSendTimestamp()));
    return root;
  }

  private static String isoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, String body) {
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("❌ Ошибка в HTTP-канале", cause);
    ctx.close();
  }
}
