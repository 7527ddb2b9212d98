package com.drillsite.service;

import com.drillsite.model.PositionFix;

import java.time.Instant;

/**
 * Снимок статистики сервиса сопоставления положений.
 */
public final class CorrelationStats {

  private final long messagesReceived;
  private final long fixesProcessed;
  private final long holesUpdated;
  private final long submissionsFailed;
  private final Instant lastUpdateTimestamp;
  private final PositionFix lastFix;

  public CorrelationStats(long messagesReceived, long fixesProcessed, long holesUpdated,
                          long submissionsFailed, Instant lastUpdateTimestamp, PositionFix lastFix) {
    this.messagesReceived = messagesReceived;
    this.fixesProcessed = fixesProcessed;
    this.holesUpdated = holesUpdated;
    this.submissionsFailed = submissionsFailed;
    this.lastUpdateTimestamp = lastUpdateTimestamp;
    this.lastFix = lastFix;
  }

  /** Все сообщения, полученные в состоянии Running, включая неразобранные. */
  public long getMessagesReceived() {
    return messagesReceived;
  }

  /** Сообщения, из которых удалось извлечь положение. */
  public long getFixesProcessed() {
    return fixesProcessed;
  }

  /** Успешные отправки drilling-speed. */
  public long getHolesUpdated() {
    return holesUpdated;
  }

  public long getSubmissionsFailed() {
    return submissionsFailed;
  }

  public Instant getLastUpdateTimestamp() {
    return lastUpdateTimestamp;
  }

  public PositionFix getLastFix() {
    return lastFix;
  }

  @Override
  public String toString() {
    return "CorrelationStats{received=" + messagesReceived + ", fixes=" + fixesProcessed
        + ", holesUpdated=" + holesUpdated + ", failed=" + submissionsFailed
        + ", lastUpdate=" + lastUpdateTimestamp + ", lastFix=" + lastFix + '}';
  }
}
