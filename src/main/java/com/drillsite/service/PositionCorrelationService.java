package com.drillsite.service;

import com.drillsite.api.DrillingSpeedReport;
import com.drillsite.api.HolesApi;
import com.drillsite.api.HolesApiException;
import com.drillsite.geo.GeoMath;
import com.drillsite.geo.HoleMatch;
import com.drillsite.geo.NearestHoleMatcher;
import com.drillsite.gnss.PositionMessageParser;
import com.drillsite.model.Hole;
import com.drillsite.model.PositionFix;
import com.drillsite.model.TelemetrySample;
import com.drillsite.mqtt.PositionTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Сервис сопоставления GNSS-положений со скважинами проекта.
 * <p>
 * Принимает сообщения о положении по подписке, находит ближайшую скважину и, если она
 * ближе порога, отправляет для неё текущие скорость и глубину бурения в API.
 * Без клиента API или проекта работает в режиме наблюдения: только считает положения.
 * <p>
 * Сообщения обрабатываются по одному в порядке поступления отдельным потоком,
 * сетевой поток транспорта не блокируется.
 */
public class PositionCorrelationService implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(PositionCorrelationService.class);

  public static final String DEFAULT_TOPIC = "device/+/upload";
  public static final double DEFAULT_MAX_DISTANCE_METERS = 10.0;
  public static final String DEFAULT_SENSOR_ID = "GNSS_RIG";
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

  private final PositionTransport transport;
  private final String topic;
  private final PositionMessageParser parser;
  private final NearestHoleMatcher matcher;
  private final HolesApi holesApi;
  private final Long projectId;
  private final HoleDirectory holeDirectory;
  private final double maxDistanceMeters;
  private final String sensorId;
  private final Clock clock;

  private final AtomicReference<TelemetrySample> currentDrilling = new AtomicReference<>();

  private final ReentrantLock statsLock = new ReentrantLock();
  private long messagesReceived;
  private long fixesProcessed;
  private long holesUpdated;
  private long submissionsFailed;
  private Instant lastUpdateTimestamp;
  private PositionFix lastFix;

  private volatile boolean running;
  private ExecutorService dispatcher;

  private PositionCorrelationService(Builder b) {
    this.transport = b.transport;
    this.topic = b.topic;
    this.clock = b.clock;
    this.parser = b.parser != null ? b.parser : new PositionMessageParser(new ObjectMapper(), b.clock);
    this.matcher = b.matcher != null ? b.matcher : new NearestHoleMatcher();
    this.holesApi = b.holesApi;
    this.projectId = b.projectId;
    this.holeDirectory = b.holeDirectory != null || b.holesApi == null
        ? b.holeDirectory
        : new HoleDirectory(b.holesApi, b.holeCacheTtl, b.clock);
    this.maxDistanceMeters = b.maxDistanceMeters;
    this.sensorId = b.sensorId;
  }

  public static Builder builder(PositionTransport transport) {
    return new Builder(transport);
  }

  /**
   * Подключается к брокеру и подписывается на топик.
   *
   * @return false, если подключение или подписка не удались.
   */
  public synchronized boolean start() {
    if (running) {
      return true;
    }
    if (!transport.connect()) {
      logger.error("❌ Сервис GNSS не запущен: нет подключения к брокеру");
      return false;
    }

    dispatcher = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "gnss-dispatcher");
      t.setDaemon(true);
      return t;
    });
    running = true;
    transport.setMessageListener(this::dispatch);

    if (!transport.subscribe(topic)) {
      logger.error("❌ Сервис GNSS не запущен: подписка на {} не удалась", topic);
      running = false;
      transport.setMessageListener(null);
      transport.disconnect();
      shutdownDispatcher();
      return false;
    }

    logger.info("🚀 Сервис GNSS запущен (топик: {}, режим: {})", topic,
        isRemoteLinked() ? "проект " + projectId : "наблюдение");
    return true;
  }

  /**
   * Отписывается, отключается от брокера и дожидается обработки уже принятых сообщений.
   */
  public synchronized void stop() {
    if (!running) {
      return;
    }
    transport.setMessageListener(null);
    try {
      transport.unsubscribe(topic);
    } finally {
      transport.disconnect();
    }
    // Сообщения, уже стоящие в очереди обработчика, обрабатываются до перехода в Stopped
    shutdownDispatcher();
    running = false;
    logger.info("Сервис GNSS остановлен. {}", getStats());
  }

  @Override
  public void close() {
    stop();
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Задаёт текущие данные бурения для следующего удачного сопоставления.
   * Последняя запись побеждает, очереди на этом уровне нет.
   *
   * @param velocityMetersPerSecond Скорость бурения, м/с.
   * @param depthMeters             Глубина, м.
   */
  public void setDrillingData(double velocityMetersPerSecond, double depthMeters) {
    currentDrilling.set(new TelemetrySample(velocityMetersPerSecond, depthMeters, clock.instant()));
  }

  /**
   * Обрабатывает одно входящее сообщение. Исключения наружу не выбрасываются.
   *
   * @param topic   Топик сообщения.
   * @param payload Тело сообщения (NMEA или JSON).
   */
  public void onMessage(String topic, String payload) {
    if (!running) {
      logger.debug("Сообщение из {} пропущено: сервис остановлен", topic);
      return;
    }
    statsLock.lock();
    try {
      messagesReceived++;
    } finally {
      statsLock.unlock();
    }

    try {
      Optional<PositionFix> fix = parser.parse(payload);
      if (fix.isEmpty()) {
        logger.warn("Координаты не найдены в сообщении из {}", topic);
        return;
      }
      processPosition(fix.get());
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка обработки сообщения из {}", topic, e);
    }
  }

  void processPosition(PositionFix fix) {
    statsLock.lock();
    try {
      fixesProcessed++;
      lastFix = fix;
    } finally {
      statsLock.unlock();
    }

    if (!isRemoteLinked()) {
      return;
    }

    List<Hole> holes = holeDirectory.getHoles(projectId);
    if (holes.isEmpty()) {
      logger.info("Нет скважин для сравнения (проект {})", projectId);
      return;
    }

    HoleMatch match = matcher.findNearest(holes, fix);
    Optional<Hole> nearest = match.getHole();
    if (nearest.isEmpty()) {
      logger.info("Ни у одной из {} скважин нет координат", holes.size());
      return;
    }
    if (!match.isWithin(maxDistanceMeters)) {
      logger.debug("Ближайшая скважина {} слишком далеко ({} > {} м)",
          nearest.get().getExternalId(), GeoMath.formatDistance(match.getDistanceMeters()), maxDistanceMeters);
      return;
    }

    TelemetrySample drilling = currentDrilling.get();
    if (drilling == null) {
      logger.debug("Скважина {} рядом, но данных бурения ещё нет", nearest.get().getExternalId());
      return;
    }
    submit(nearest.get(), match.getDistanceMeters(), drilling);
  }

  private void submit(Hole hole, double distance, TelemetrySample drilling) {
    DrillingSpeedReport report = new DrillingSpeedReport(
        drilling.getVelocityMetersPerSecond(), drilling.getDepthMeters(), clock.instant(), sensorId);
    try {
      holesApi.postDrillingSpeed(projectId, hole.getExternalId(), report);
    } catch (HolesApiException | RuntimeException e) {
      statsLock.lock();
      try {
        submissionsFailed++;
      } finally {
        statsLock.unlock();
      }
      logger.warn("❌ Не удалось отправить drilling-speed для скважины {}: {}", hole.getExternalId(), e.getMessage());
      return;
    }

    statsLock.lock();
    try {
      holesUpdated++;
      lastUpdateTimestamp = clock.instant();
    } finally {
      statsLock.unlock();
    }
    logger.info("✅ drilling-speed отправлен для скважины {} (расстояние: {}, скорость: {} м/с, глубина: {} м)",
        hole.getExternalId(), GeoMath.formatDistance(distance),
        drilling.getVelocityMetersPerSecond(), drilling.getDepthMeters());
  }

  public CorrelationStats getStats() {
    statsLock.lock();
    try {
      return new CorrelationStats(messagesReceived, fixesProcessed, holesUpdated, submissionsFailed,
          lastUpdateTimestamp, lastFix);
    } finally {
      statsLock.unlock();
    }
  }

  /**
   * Сбрасывает кэш скважин: следующее положение загрузит их из API заново.
   */
  public void clearHoleCache() {
    if (holeDirectory != null) {
      holeDirectory.invalidate();
    }
  }

  private boolean isRemoteLinked() {
    return holesApi != null && projectId != null && holeDirectory != null;
  }

  private void dispatch(String messageTopic, String payload) {
    ExecutorService executor = dispatcher;
    if (executor == null) {
      return;
    }
    try {
      executor.execute(() -> onMessage(messageTopic, payload));
    } catch (RejectedExecutionException e) {
      logger.debug("Сообщение из {} отброшено при остановке", messageTopic);
    }
  }

  private void shutdownDispatcher() {
    ExecutorService executor = dispatcher;
    dispatcher = null;
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Обработчик GNSS-сообщений не завершился за {} с", STOP_TIMEOUT.toSeconds());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public static final class Builder {
    private final PositionTransport transport;
    private String topic = DEFAULT_TOPIC;
    private HolesApi holesApi;
    private Long projectId;
    private HoleDirectory holeDirectory;
    private Duration holeCacheTtl = HoleDirectory.DEFAULT_TTL;
    private double maxDistanceMeters = DEFAULT_MAX_DISTANCE_METERS;
    private String sensorId = DEFAULT_SENSOR_ID;
    private PositionMessageParser parser;
    private NearestHoleMatcher matcher;
    private Clock clock = Clock.systemUTC();

    private Builder(PositionTransport transport) {
      this.transport = transport;
    }

    public Builder topic(String topic) {
      this.topic = topic;
      return this;
    }

    /**
     * Привязка к API: без неё сервис только принимает положения.
     */
    public Builder remote(HolesApi holesApi, long projectId) {
      this.holesApi = holesApi;
      this.projectId = projectId;
      return this;
    }

    public Builder holeDirectory(HoleDirectory holeDirectory) {
      this.holeDirectory = holeDirectory;
      return this;
    }

    public Builder holeCacheTtl(Duration holeCacheTtl) {
      this.holeCacheTtl = holeCacheTtl;
      return this;
    }

    public Builder maxDistanceMeters(double maxDistanceMeters) {
      this.maxDistanceMeters = maxDistanceMeters;
      return this;
    }

    public Builder sensorId(String sensorId) {
      this.sensorId = sensorId;
      return this;
    }

    public Builder parser(PositionMessageParser parser) {
      this.parser = parser;
      return this;
    }

    public Builder matcher(NearestHoleMatcher matcher) {
      this.matcher = matcher;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public PositionCorrelationService build() {
      if (transport == null) {
        throw new IllegalArgumentException("Transport cannot be null");
      }
      if (topic == null || topic.isBlank()) {
        throw new IllegalArgumentException("Topic cannot be empty");
      }
      if (maxDistanceMeters < 0) {
        throw new IllegalArgumentException("Max distance must not be negative: " + maxDistanceMeters);
      }
      return new PositionCorrelationService(this);
    }
  }
}
