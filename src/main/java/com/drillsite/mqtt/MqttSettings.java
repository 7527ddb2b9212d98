package com.drillsite.mqtt;

import java.time.Duration;
import java.util.UUID;

/**
 * Параметры подключения к MQTT-брокеру.
 */
public final class MqttSettings {

  private final String host;
  private final int port;
  private final String clientId;
  private final String username;
  private final String password;
  private final boolean tlsEnabled;
  private final String caCertsPath;
  private final int keepAliveSeconds;
  private final Duration operationTimeout;

  private MqttSettings(Builder b) {
    if (b.host == null || b.host.isBlank()) {
      throw new IllegalArgumentException("MQTT broker host cannot be empty");
    }
    if (b.port < 1 || b.port > 65535) {
      throw new IllegalArgumentException("MQTT broker port out of range: " + b.port);
    }
    this.host = b.host;
    this.port = b.port;
    this.clientId = b.clientId != null && !b.clientId.isBlank()
        ? b.clientId
        : "drill-bridge-" + UUID.randomUUID().toString().substring(0, 8);
    this.username = b.username;
    this.password = b.password;
    this.tlsEnabled = b.tlsEnabled;
    this.caCertsPath = b.caCertsPath;
    this.keepAliveSeconds = Math.max(1, b.keepAliveSeconds);
    this.operationTimeout = b.operationTimeout;
  }

  public static Builder builder(String host, int port) {
    return new Builder(host, port);
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String getClientId() {
    return clientId;
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }

  public boolean isTlsEnabled() {
    return tlsEnabled;
  }

  public String getCaCertsPath() {
    return caCertsPath;
  }

  public int getKeepAliveSeconds() {
    return keepAliveSeconds;
  }

  /**
   * @return Таймаут ожидания CONNACK/SUBACK/UNSUBACK и установки TCP-соединения.
   */
  public Duration getOperationTimeout() {
    return operationTimeout;
  }

  @Override
  public String toString() {
    // пароль в логи не попадает
    return "MqttSettings{" + host + ":" + port + ", clientId=" + clientId
        + (username != null ? ", user=" + username : "") + ", tls=" + tlsEnabled + '}';
  }

  public static final class Builder {
    private final String host;
    private final int port;
    private String clientId;
    private String username;
    private String password;
    private boolean tlsEnabled;
    private String caCertsPath;
    private int keepAliveSeconds = 60;
    private Duration operationTimeout = Duration.ofSeconds(10);

    private Builder(String host, int port) {
      this.host = host;
      this.port = port;
    }

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder credentials(String username, String password) {
      this.username = username;
      this.password = password;
      return this;
    }

    public Builder tls(boolean enabled, String caCertsPath) {
      this.tlsEnabled = enabled;
      this.caCertsPath = caCertsPath;
      return this;
    }

    public Builder keepAliveSeconds(int keepAliveSeconds) {
      this.keepAliveSeconds = keepAliveSeconds;
      return this;
    }

    public Builder operationTimeout(Duration operationTimeout) {
      this.operationTimeout = operationTimeout;
      return this;
    }

    public MqttSettings build() {
      return new MqttSettings(this);
    }
  }
}
