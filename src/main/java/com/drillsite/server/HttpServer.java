package com.drillsite.server;

import com.drillsite.api.HttpHolesApiClient;
import com.drillsite.config.BridgeSettings;
import com.drillsite.mqtt.NettyMqttClient;
import com.drillsite.service.PositionCorrelationService;
import com.drillsite.service.TelemetryCoalescingQueue;
import com.drillsite.service.TelemetryService;
import com.drillsite.service.TelemetryServiceImpl;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Главный класс приложения. Запускает мост GNSS/телеметрии и HTTP-сервер на Netty.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private final int port;
  private final TelemetryService telemetryService;

  /**
   * Конструктор HTTP-сервера.
   * @param port Порт, на котором будет работать сервер.
   * @param telemetryService Сервис приёма телеметрии.
   */
  public HttpServer(int port, TelemetryService telemetryService) {
    this.port = port;
    this.telemetryService = telemetryService;
  }

  /**
   * Запускает сервер и ожидает завершения.
   * @throws InterruptedException если поток прерван во время работы сервера.
   */
  public void start() throws InterruptedException {
    EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    EventLoopGroup workerGroup = new NioEventLoopGroup();
    try {
      ServerBootstrap b = new ServerBootstrap();
      b.group(bossGroup, workerGroup)
          .channel(NioServerSocketChannel.class)
          .childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            public void initChannel(SocketChannel ch) {
              ch.pipeline()
                  .addLast(new HttpServerCodec())
                  .addLast(new HttpObjectAggregator(65536))
                  .addLast(new HttpServerHandler(telemetryService));
            }
          })
          .option(ChannelOption.SO_BACKLOG, 128)
          .childOption(ChannelOption.SO_KEEPALIVE, true);

      ChannelFuture f = b.bind(port).sync();
      logger.info("🚀 Сервер запущен на http://localhost:{}", port);
      f.channel().closeFuture().sync();
    } finally {
      workerGroup.shutdownGracefully();
      bossGroup.shutdownGracefully();
    }
  }

  /**
   * Точка входа в приложение.
   * Читает настройки, подключается к MQTT, запускает очередь доставки и HTTP-сервер.
   * @param args Аргументы командной строки (не используются).
   * @throws Exception если произошла ошибка при запуске.
   */
  public static void main(String[] args) throws Exception {
    BridgeSettings settings = BridgeSettings.load();

    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(settings.getApiTimeout())
        .build();
    HttpHolesApiClient holesApi = new HttpHolesApiClient(httpClient, settings.getApiBaseUrl(), settings.getApiTimeout());

    NettyMqttClient mqttClient = new NettyMqttClient(settings.getMqtt());
    PositionCorrelationService.Builder correlationBuilder = PositionCorrelationService.builder(mqttClient)
        .topic(settings.getGnssTopic())
        .maxDistanceMeters(settings.getMaxDistanceMeters())
        .sensorId(settings.getGnssSensorId())
        .holeCacheTtl(settings.getHoleCacheTtl());
    if (settings.getProjectId() != null) {
      correlationBuilder.remote(holesApi, settings.getProjectId());
    } else {
      logger.warn("project.id не задан: GNSS-сервис работает в режиме наблюдения");
    }
    PositionCorrelationService correlationService = correlationBuilder.build();

    long projectId = settings.getProjectId() != null ? settings.getProjectId() : 0L;
    TelemetryCoalescingQueue queue = new TelemetryCoalescingQueue(holesApi, projectId,
        settings.getTelemetryHoleId(), settings.getQueueCapacity(), settings.getFlushInterval(),
        settings.getTelemetrySensorId(), Clock.systemUTC());

    if (!correlationService.start()) {
      logger.error("❌ GNSS-сервис не запущен, положения не обрабатываются");
    }
    if (settings.getProjectId() == null || !queue.start()) {
      logger.warn("Доставка телеметрии не запущена: нужны project.id и telemetry.hole.id");
    }

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      logger.info("Остановка моста...");
      queue.stop();
      correlationService.stop();
    }, "bridge-shutdown"));

    new HttpServer(settings.getServerPort(), new TelemetryServiceImpl(queue, correlationService)).start();
  }
}
