package com.drillsite.service;

import com.drillsite.api.HolesApi;
import com.drillsite.api.HolesApiException;
import com.drillsite.model.Hole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Кэш списка скважин проекта с ограниченным временем жизни.
 * <p>
 * Снимок заменяется только целиком после успешной загрузки. Запрос к API выполняется
 * вне блокировки, поэтому два потока, одновременно заставшие истёкший кэш, могут
 * оба обратиться к API; результат применяется идемпотентно.
 */
public class HoleDirectory {

  private static final Logger logger = LoggerFactory.getLogger(HoleDirectory.class);

  public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

  private final HolesApi holesApi;
  private final Duration ttl;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private HoleSetCache cache;

  public HoleDirectory(HolesApi holesApi) {
    this(holesApi, DEFAULT_TTL, Clock.systemUTC());
  }

  /**
   * @param holesApi Клиент API для загрузки скважин.
   * @param ttl      Время жизни снимка.
   * @param clock    Источник времени.
   */
  public HoleDirectory(HolesApi holesApi, Duration ttl, Clock clock) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Hole cache TTL must be positive: " + ttl);
    }
    this.holesApi = holesApi;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Возвращает скважины проекта: из кэша, если снимок ещё действителен, иначе из API.
   * <p>
   * При ошибке API кэш и его время не меняются: возвращается последний удачный снимок
   * этого проекта, а если его нет, пустой список.
   *
   * @param projectId ID проекта.
   * @return Неизменяемый список скважин.
   */
  public List<Hole> getHoles(long projectId) {
    HoleSetCache current;
    lock.lock();
    try {
      current = cache;
    } finally {
      lock.unlock();
    }

    if (current != null && current.isValidFor(projectId, clock.instant())) {
      return current.holes;
    }

    List<Hole> fetched;
    try {
      fetched = holesApi.fetchHoles(projectId);
    } catch (HolesApiException e) {
      if (current != null && current.projectId == projectId) {
        logger.warn("❌ Не удалось обновить скважины проекта {}, используется снимок от {}: {}",
            projectId, current.fetchedAt, e.getMessage());
        return current.holes;
      }
      logger.warn("❌ Не удалось получить скважины проекта {}: {}", projectId, e.getMessage());
      return List.of();
    }

    HoleSetCache fresh = new HoleSetCache(projectId, List.copyOf(fetched), clock.instant(), ttl);
    lock.lock();
    try {
      cache = fresh;
    } finally {
      lock.unlock();
    }
    logger.info("✅ Загружено {} скважин проекта {} из API", fresh.holes.size(), projectId);
    return fresh.holes;
  }

  /**
   * Сбрасывает кэш: следующий {@link #getHoles(long)} обязательно обратится к API.
   */
  public void invalidate() {
    lock.lock();
    try {
      cache = null;
    } finally {
      lock.unlock();
    }
    logger.debug("Кэш скважин сброшен");
  }

  /** Полный снимок последней успешной загрузки. */
  private static final class HoleSetCache {
    final long projectId;
    final List<Hole> holes;
    final Instant fetchedAt;
    final Duration ttl;

    HoleSetCache(long projectId, List<Hole> holes, Instant fetchedAt, Duration ttl) {
      this.projectId = projectId;
      this.holes = holes;
      this.fetchedAt = fetchedAt;
      this.ttl = ttl;
    }

    boolean isValidFor(long requestedProject, Instant now) {
      return projectId == requestedProject && Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
  }
}
