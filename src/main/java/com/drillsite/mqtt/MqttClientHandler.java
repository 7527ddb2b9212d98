package com.drillsite.mqtt;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.codec.mqtt.MqttUnsubAckMessage;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Обработчик входящих MQTT-пакетов одного соединения.
 * <p>
 * Завершает ожидания CONNACK/SUBACK/UNSUBACK, передаёт PUBLISH получателю,
 * подтверждает PUBLISH с QoS 1 и шлёт PINGREQ при простое записи.
 */
public class MqttClientHandler extends SimpleChannelInboundHandler<MqttMessage> {

  private static final Logger logger = LoggerFactory.getLogger(MqttClientHandler.class);

  /** Код отказа в SUBACK. */
  private static final int SUBACK_FAILURE = 0x80;

  private final MessageListener listener;
  private final CompletableFuture<MqttConnectReturnCode> connAck = new CompletableFuture<>();
  private final Map<Integer, CompletableFuture<Boolean>> pendingAcks = new ConcurrentHashMap<>();

  /**
   * @param listener Получатель опубликованных сообщений.
   */
  public MqttClientHandler(MessageListener listener) {
    this.listener = listener;
  }

  /**
   * @return Будущий код ответа брокера на CONNECT.
   */
  public CompletableFuture<MqttConnectReturnCode> connAck() {
    return connAck;
  }

  /**
   * Регистрирует ожидание SUBACK/UNSUBACK для пакета с указанным id.
   *
   * @return true при подтверждении, false при отказе брокера.
   */
  public CompletableFuture<Boolean> expectAck(int messageId) {
    CompletableFuture<Boolean> future = new CompletableFuture<>();
    pendingAcks.put(messageId, future);
    return future;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
    if (msg.decoderResult().isFailure()) {
      logger.error("❌ Некорректный MQTT-пакет от брокера", msg.decoderResult().cause());
      ctx.close();
      return;
    }

    MqttMessageType type = msg.fixedHeader().messageType();
    switch (type) {
      case CONNACK:
        connAck.complete(((MqttConnAckMessage) msg).variableHeader().connectReturnCode());
        break;
      case SUBACK:
        MqttSubAckMessage subAck = (MqttSubAckMessage) msg;
        boolean granted = subAck.payload().grantedQoSLevels().stream().noneMatch(q -> q == SUBACK_FAILURE);
        completeAck(subAck.variableHeader().messageId(), granted);
        break;
      case UNSUBACK:
        completeAck(((MqttUnsubAckMessage) msg).variableHeader().messageId(), true);
        break;
      case PUBLISH:
        handlePublish(ctx, (MqttPublishMessage) msg);
        break;
      case PINGRESP:
      case PUBACK:
        logger.trace("MQTT {}", type);
        break;
      default:
        logger.debug("Неожиданный MQTT-пакет: {}", type);
    }
  }

  private void handlePublish(ChannelHandlerContext ctx, MqttPublishMessage msg) {
    String topic = msg.variableHeader().topicName();
    String payload = msg.payload().toString(StandardCharsets.UTF_8);

    if (msg.fixedHeader().qosLevel() == MqttQoS.AT_LEAST_ONCE) {
      MqttFixedHeader header = new MqttFixedHeader(MqttMessageType.PUBACK, false, MqttQoS.AT_MOST_ONCE, false, 2);
      ctx.writeAndFlush(new MqttMessage(header, MqttMessageIdVariableHeader.from(msg.variableHeader().packetId())));
    }

    try {
      listener.onMessage(topic, payload);
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка обработки сообщения из топика {}", topic, e);
    }
  }

  private void completeAck(int messageId, boolean success) {
    CompletableFuture<Boolean> future = pendingAcks.remove(messageId);
    if (future != null) {
      future.complete(success);
    } else {
      logger.debug("Подтверждение для неизвестного пакета {}", messageId);
    }
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.WRITER_IDLE) {
      MqttFixedHeader header = new MqttFixedHeader(MqttMessageType.PINGREQ, false, MqttQoS.AT_MOST_ONCE, false, 0);
      ctx.writeAndFlush(new MqttMessage(header));
      return;
    }
    super.userEventTriggered(ctx, evt);
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    IllegalStateException closed = new IllegalStateException("MQTT connection closed");
    connAck.completeExceptionally(closed);
    pendingAcks.values().forEach(f -> f.completeExceptionally(closed));
    pendingAcks.clear();
    logger.info("MQTT-соединение закрыто");
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("❌ Ошибка MQTT-соединения", cause);
    ctx.close();
  }
}
