package com.drillsite.mqtt;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MQTT 3.1.1 клиент на Netty: подписка на GNSS-топики и публикация данных датчиков.
 * <p>
 * Сессия всегда чистая (clean session), подписки выполняются с QoS 0.
 */
public class NettyMqttClient implements PositionTransport, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(NettyMqttClient.class);

  private final MqttSettings settings;
  private final AtomicInteger messageIds = new AtomicInteger(1);

  private volatile MessageListener listener;
  private EventLoopGroup group;
  private volatile Channel channel;
  private MqttClientHandler handler;

  public NettyMqttClient(MqttSettings settings) {
    this.settings = settings;
  }

  @Override
  public synchronized boolean connect() {
    if (isConnected()) {
      return true;
    }
    logger.info("Подключение к MQTT-брокеру {}", settings);

    SslContext sslContext;
    try {
      sslContext = settings.isTlsEnabled() ? buildSslContext() : null;
    } catch (SSLException e) {
      logger.error("❌ Не удалось настроить TLS для MQTT", e);
      return false;
    }

    long timeoutMillis = settings.getOperationTimeout().toMillis();
    group = new NioEventLoopGroup(1);
    handler = new MqttClientHandler(this::deliver);
    MqttClientHandler connectionHandler = handler;

    Bootstrap bootstrap = new Bootstrap()
        .group(group)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMillis)
        .option(ChannelOption.SO_KEEPALIVE, true)
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ChannelPipeline p = ch.pipeline();
            if (sslContext != null) {
              p.addLast("ssl", sslContext.newHandler(ch.alloc(), settings.getHost(), settings.getPort()));
            }
            p.addLast("decoder", new MqttDecoder());
            p.addLast("encoder", MqttEncoder.INSTANCE);
            p.addLast("idle", new IdleStateHandler(0, settings.getKeepAliveSeconds(), 0));
            p.addLast("handler", connectionHandler);
          }
        });

    try {
      ChannelFuture connectFuture = bootstrap.connect(settings.getHost(), settings.getPort()).sync();
      channel = connectFuture.channel();
      channel.writeAndFlush(connectMessage());

      MqttConnectReturnCode code = connectionHandler.connAck().get(timeoutMillis, TimeUnit.MILLISECONDS);
      if (code != MqttConnectReturnCode.CONNECTION_ACCEPTED) {
        logger.error("❌ MQTT-брокер отклонил подключение: {}", code);
        shutdown();
        return false;
      }
      logger.info("✅ Подключено к MQTT-брокеру {}:{}", settings.getHost(), settings.getPort());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Подключение к MQTT прервано");
      shutdown();
      return false;
    } catch (Exception e) {
      logger.error("❌ Не удалось подключиться к MQTT-брокеру {}:{}", settings.getHost(), settings.getPort(), e);
      shutdown();
      return false;
    }
  }

  @Override
  public boolean subscribe(String topic) {
    Channel ch = channel;
    if (ch == null || !ch.isActive()) {
      logger.warn("Подписка на {} невозможна: нет соединения", topic);
      return false;
    }
    int id = nextMessageId();
    CompletableFuture<Boolean> ack = handler.expectAck(id);
    ch.writeAndFlush(MqttMessageBuilders.subscribe()
        .messageId(id)
        .addSubscription(MqttQoS.AT_MOST_ONCE, topic)
        .build());

    boolean granted = awaitAck(ack, "SUBSCRIBE " + topic);
    if (granted) {
      logger.info("✅ Подписка на топик {}", topic);
    } else {
      logger.error("❌ Брокер не подтвердил подписку на {}", topic);
    }
    return granted;
  }

  @Override
  public void unsubscribe(String topic) {
    Channel ch = channel;
    if (ch == null || !ch.isActive()) {
      return;
    }
    int id = nextMessageId();
    CompletableFuture<Boolean> ack = handler.expectAck(id);
    ch.writeAndFlush(MqttMessageBuilders.unsubscribe()
        .messageId(id)
        .addTopicFilter(topic)
        .build());
    if (awaitAck(ack, "UNSUBSCRIBE " + topic)) {
      logger.info("Отписка от топика {}", topic);
    }
  }

  /**
   * Публикует сообщение (например, данные лазерного датчика) с QoS 0 или 1.
   * Подтверждение PUBACK для QoS 1 не ожидается.
   *
   * @return true, если пакет записан в сокет.
   */
  public boolean publish(String topic, String payload, MqttQoS qos, boolean retain) {
    if (qos == MqttQoS.EXACTLY_ONCE) {
      throw new IllegalArgumentException("QoS 2 is not supported");
    }
    Channel ch = channel;
    if (ch == null || !ch.isActive()) {
      logger.warn("Публикация в {} невозможна: нет соединения", topic);
      return false;
    }
    int id = qos == MqttQoS.AT_MOST_ONCE ? 0 : nextMessageId();
    ChannelFuture write = ch.writeAndFlush(MqttMessageBuilders.publish()
        .topicName(topic)
        .qos(qos)
        .retained(retain)
        .messageId(id)
        .payload(Unpooled.copiedBuffer(payload, StandardCharsets.UTF_8))
        .build());
    if (!write.awaitUninterruptibly(settings.getOperationTimeout().toMillis()) || !write.isSuccess()) {
      logger.error("❌ Публикация в {} не выполнена", topic, write.cause());
      return false;
    }
    return true;
  }

  @Override
  public synchronized void disconnect() {
    Channel ch = channel;
    if (ch != null && ch.isActive()) {
      MqttFixedHeader header = new MqttFixedHeader(MqttMessageType.DISCONNECT, false, MqttQoS.AT_MOST_ONCE, false, 0);
      ch.writeAndFlush(new MqttMessage(header)).awaitUninterruptibly(1, TimeUnit.SECONDS);
    }
    shutdown();
    logger.info("Отключено от MQTT-брокера {}:{}", settings.getHost(), settings.getPort());
  }

  @Override
  public void close() {
    disconnect();
  }

  @Override
  public boolean isConnected() {
    Channel ch = channel;
    return ch != null && ch.isActive();
  }

  @Override
  public void setMessageListener(MessageListener listener) {
    this.listener = listener;
  }

  private void deliver(String topic, String payload) {
    MessageListener current = listener;
    if (current != null) {
      current.onMessage(topic, payload);
    }
  }

  private MqttConnectMessage connectMessage() {
    MqttMessageBuilders.ConnectBuilder builder = MqttMessageBuilders.connect()
        .clientId(settings.getClientId())
        .protocolVersion(MqttVersion.MQTT_3_1_1)
        .cleanSession(true)
        .keepAlive(settings.getKeepAliveSeconds());
    if (settings.getUsername() != null) {
      builder.username(settings.getUsername());
      if (settings.getPassword() != null) {
        builder.password(settings.getPassword().getBytes(StandardCharsets.UTF_8));
      }
    }
    return builder.build();
  }

  private SslContext buildSslContext() throws SSLException {
    SslContextBuilder builder = SslContextBuilder.forClient();
    if (settings.getCaCertsPath() != null && !settings.getCaCertsPath().isBlank()) {
      builder.trustManager(new File(settings.getCaCertsPath()));
    }
    return builder.build();
  }

  private boolean awaitAck(CompletableFuture<Boolean> ack, String operation) {
    try {
      return ack.get(settings.getOperationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException | TimeoutException e) {
      logger.warn("Нет подтверждения {}: {}", operation, e.toString());
      return false;
    }
  }

  // id пакета MQTT: 1..65535
  private int nextMessageId() {
    while (true) {
      int id = messageIds.getAndIncrement() & 0xFFFF;
      if (id != 0) {
        return id;
      }
    }
  }

  private void shutdown() {
    Channel ch = channel;
    channel = null;
    if (ch != null) {
      ch.close().awaitUninterruptibly();
    }
    if (group != null) {
      group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
      group = null;
    }
  }
}
