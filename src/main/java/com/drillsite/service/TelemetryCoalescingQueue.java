package com.drillsite.service;

import com.drillsite.api.DrillingSpeedReport;
import com.drillsite.api.HolesApi;
import com.drillsite.api.HolesApiException;
import com.drillsite.model.TelemetrySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Очередь телеметрии бурения с периодической доставкой только самого свежего отсчёта.
 * <p>
 * Гарантия: "не более чем последнее значение": при каждой отправке берётся последний
 * отсчёт, после успешной отправки очередь очищается целиком. Более старые отсчёты
 * не отправляются никогда. Для аудита такая очередь не подходит.
 * <p>
 * Очередь ограничена по размеру; при переполнении вытесняется самый старый отсчёт.
 * Отправку выполняет один фоновый поток планировщика; запрос к API идёт вне блокировки.
 */
public class TelemetryCoalescingQueue implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryCoalescingQueue.class);

  public static final int DEFAULT_CAPACITY = 1000;
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(2);
  public static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);
  public static final String DEFAULT_SENSOR_ID = "LASER_SENSOR";

  private final HolesApi holesApi;
  private final long projectId;
  private final int capacity;
  private final Duration flushInterval;
  private final String sensorId;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final ArrayDeque<TelemetrySample> queue;
  private String holeId;
  private long sent;
  private long failed;
  private Instant lastSendTimestamp;

  private volatile boolean running;
  private ScheduledExecutorService executor;

  public TelemetryCoalescingQueue(HolesApi holesApi, long projectId, String holeId) {
    this(holesApi, projectId, holeId, DEFAULT_CAPACITY, DEFAULT_FLUSH_INTERVAL, DEFAULT_SENSOR_ID,
        Clock.systemUTC());
  }

  /**
   * @param holesApi      Клиент API, принимающий drilling-speed.
   * @param projectId     ID проекта.
   * @param holeId        Скважина, для которой отправляются данные; может быть задана позже.
   * @param capacity      Максимальное число отсчётов в очереди.
   * @param flushInterval Период отправки.
   * @param sensorId      Идентификатор датчика в теле запроса.
   * @param clock         Источник времени.
   */
  public TelemetryCoalescingQueue(HolesApi holesApi, long projectId, String holeId, int capacity,
                                  Duration flushInterval, String sensorId, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
    }
    if (flushInterval.isNegative() || flushInterval.isZero()) {
      throw new IllegalArgumentException("Flush interval must be positive: " + flushInterval);
    }
    this.holesApi = holesApi;
    this.projectId = projectId;
    this.holeId = holeId;
    this.capacity = capacity;
    this.flushInterval = flushInterval;
    this.sensorId = sensorId;
    this.clock = clock;
    this.queue = new ArrayDeque<>(Math.min(capacity, 64));
  }

  /**
   * Добавляет отсчёт. Вызывается из любого потока.
   */
  public void add(TelemetrySample sample) {
    lock.lock();
    try {
      if (queue.size() >= capacity) {
        queue.pollFirst();
      }
      queue.addLast(sample);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Добавляет отсчёт с текущим временем.
   *
   * @param velocityMetersPerSecond Скорость бурения, м/с.
   * @param depthMeters             Глубина, м.
   */
  public void add(double velocityMetersPerSecond, double depthMeters) {
    add(new TelemetrySample(velocityMetersPerSecond, depthMeters, clock.instant()));
  }

  public void setHoleId(String holeId) {
    lock.lock();
    try {
      this.holeId = holeId;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Запускает фоновую отправку.
   *
   * @return false, если не задана скважина назначения.
   */
  public synchronized boolean start() {
    if (running) {
      return true;
    }
    String target = currentHoleId();
    if (target == null || target.isBlank()) {
      logger.warn("Отправка телеметрии не запущена: не задана скважина (проект {})", projectId);
      return false;
    }

    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "telemetry-flush");
      t.setDaemon(true);
      return t;
    });
    long periodMillis = flushInterval.toMillis();
    executor.scheduleAtFixedRate(this::flush, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    running = true;
    logger.info("🚀 Отправка телеметрии запущена: проект {}, скважина {}, период {} мс",
        projectId, target, periodMillis);
    return true;
  }

  /**
   * Останавливает отправку: делает последнюю попытку отправить свежий отсчёт
   * и ждёт завершения потока не дольше {@link #STOP_TIMEOUT}.
   */
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;

    try {
      executor.submit(this::flush);
    } catch (RejectedExecutionException e) {
      logger.warn("Финальная отправка телеметрии не запланирована", e);
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Поток отправки не завершился за {} с, остановка не гарантирована",
            STOP_TIMEOUT.toSeconds());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Прервано ожидание остановки потока отправки");
    }
    logger.info("Отправка телеметрии остановлена. {}", getStats());
  }

  @Override
  public void close() {
    stop();
  }

  /**
   * Отправляет последний отсчёт из очереди.
   * <p>
   * Успех очищает всю очередь; при ошибке очередь не меняется и счётчик ошибок растёт.
   * Исключения наружу не выбрасываются.
   *
   * @return true, если отсчёт доставлен.
   */
  public boolean flush() {
    TelemetrySample latest;
    String target;
    lock.lock();
    try {
      latest = queue.peekLast();
      target = holeId;
    } finally {
      lock.unlock();
    }
    if (latest == null) {
      return false;
    }
    if (target == null || target.isBlank()) {
      logger.debug("Нет скважины назначения, {} отсчётов ждут отправки", size());
      return false;
    }

    DrillingSpeedReport report = DrillingSpeedReport.from(latest, sensorId);
    try {
      holesApi.postDrillingSpeed(projectId, target, report);
    } catch (HolesApiException | RuntimeException e) {
      recordFailure();
      logger.warn("❌ Не удалось отправить телеметрию для скважины {}: {}", target, e.getMessage());
      return false;
    }

    lock.lock();
    try {
      queue.clear();
      sent++;
      lastSendTimestamp = clock.instant();
    } finally {
      lock.unlock();
    }
    logger.debug("✅ Телеметрия отправлена для скважины {}: {}", target, report);
    return true;
  }

  public boolean isRunning() {
    return running;
  }

  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return Копия очереди от старых отсчётов к новым.
   */
  public List<TelemetrySample> snapshot() {
    lock.lock();
    try {
      return List.copyOf(queue);
    } finally {
      lock.unlock();
    }
  }

  public DeliveryStats getStats() {
    lock.lock();
    try {
      return new DeliveryStats(sent, failed, lastSendTimestamp);
    } finally {
      lock.unlock();
    }
  }

  private void recordFailure() {
    lock.lock();
    try {
      failed++;
    } finally {
      lock.unlock();
    }
  }

  private String currentHoleId() {
    lock.lock();
    try {
      return holeId;
    } finally {
      lock.unlock();
    }
  }
}
