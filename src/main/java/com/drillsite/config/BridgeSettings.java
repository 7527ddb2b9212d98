package com.drillsite.config;

import com.drillsite.mqtt.MqttSettings;
import com.drillsite.service.HoleDirectory;
import com.drillsite.service.PositionCorrelationService;
import com.drillsite.service.TelemetryCoalescingQueue;

import java.time.Duration;

/**
 * Все настройки приложения, собранные из {@link Config}.
 */
public final class BridgeSettings {

  private final String apiBaseUrl;
  private final Duration apiTimeout;
  private final Long projectId;
  private final MqttSettings mqtt;
  private final String gnssTopic;
  private final double maxDistanceMeters;
  private final String gnssSensorId;
  private final Duration holeCacheTtl;
  private final Duration flushInterval;
  private final int queueCapacity;
  private final String telemetryHoleId;
  private final String telemetrySensorId;
  private final int serverPort;

  private BridgeSettings(String apiBaseUrl, Duration apiTimeout, Long projectId, MqttSettings mqtt,
                         String gnssTopic, double maxDistanceMeters, String gnssSensorId,
                         Duration holeCacheTtl, Duration flushInterval, int queueCapacity,
                         String telemetryHoleId, String telemetrySensorId, int serverPort) {
    this.apiBaseUrl = apiBaseUrl;
    this.apiTimeout = apiTimeout;
    this.projectId = projectId;
    this.mqtt = mqtt;
    this.gnssTopic = gnssTopic;
    this.maxDistanceMeters = maxDistanceMeters;
    this.gnssSensorId = gnssSensorId;
    this.holeCacheTtl = holeCacheTtl;
    this.flushInterval = flushInterval;
    this.queueCapacity = queueCapacity;
    this.telemetryHoleId = telemetryHoleId;
    this.telemetrySensorId = telemetrySensorId;
    this.serverPort = serverPort;
  }

  /**
   * Читает настройки из application.properties и системных свойств.
   *
   * @throws IllegalStateException если обязательный параметр не задан или значение некорректно.
   */
  public static BridgeSettings load() {
    MqttSettings mqtt = MqttSettings.builder(
            Config.getRequiredProperty("mqtt.host"),
            Config.getInt("mqtt.port", 1883))
        .clientId(Config.getProperty("mqtt.client.id"))
        .credentials(Config.getProperty("mqtt.username"), Config.getProperty("mqtt.password"))
        .tls(Config.getBoolean("mqtt.tls.enabled", false), Config.getProperty("mqtt.ca.certs"))
        .keepAliveSeconds(Config.getInt("mqtt.keepalive.seconds", 60))
        .build();

    return new BridgeSettings(
        Config.getRequiredProperty("api.base.url"),
        Duration.ofSeconds(Config.getInt("api.timeout.seconds", 10)),
        Config.getLong("project.id"),
        mqtt,
        Config.getProperty("gnss.topic", PositionCorrelationService.DEFAULT_TOPIC),
        Config.getDouble("gnss.max.distance.meters", PositionCorrelationService.DEFAULT_MAX_DISTANCE_METERS),
        Config.getProperty("gnss.sensor.id", PositionCorrelationService.DEFAULT_SENSOR_ID),
        Duration.ofSeconds(Config.getInt("holes.cache.ttl.seconds", (int) HoleDirectory.DEFAULT_TTL.toSeconds())),
        Duration.ofMillis(Math.round(Config.getDouble("telemetry.flush.interval.seconds",
            TelemetryCoalescingQueue.DEFAULT_FLUSH_INTERVAL.toSeconds()) * 1000)),
        Config.getInt("telemetry.queue.capacity", TelemetryCoalescingQueue.DEFAULT_CAPACITY),
        Config.getProperty("telemetry.hole.id"),
        Config.getProperty("telemetry.sensor.id", TelemetryCoalescingQueue.DEFAULT_SENSOR_ID),
        Config.getInt("server.port", 8081)
    );
  }

  public String getApiBaseUrl() {
    return apiBaseUrl;
  }

  public Duration getApiTimeout() {
    return apiTimeout;
  }

  /**
   * @return ID проекта или {@code null}: тогда GNSS-сервис работает в режиме наблюдения.
   */
  public Long getProjectId() {
    return projectId;
  }

  public MqttSettings getMqtt() {
    return mqtt;
  }

  public String getGnssTopic() {
    return gnssTopic;
  }

  public double getMaxDistanceMeters() {
    return maxDistanceMeters;
  }

  public String getGnssSensorId() {
    return gnssSensorId;
  }

  public Duration getHoleCacheTtl() {
    return holeCacheTtl;
  }

  public Duration getFlushInterval() {
    return flushInterval;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public String getTelemetryHoleId() {
    return telemetryHoleId;
  }

  public String getTelemetrySensorId() {
    return telemetrySensorId;
  }

  public int getServerPort() {
    return serverPort;
  }
}
