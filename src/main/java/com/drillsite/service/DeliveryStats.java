package com.drillsite.service;

import java.time.Instant;

/**
 * Снимок статистики доставки телеметрии.
 */
public final class DeliveryStats {

  private final long sent;
  private final long failed;
  private final Instant lastSendTimestamp;

  public DeliveryStats(long sent, long failed, Instant lastSendTimestamp) {
    this.sent = sent;
    this.failed = failed;
    this.lastSendTimestamp = lastSendTimestamp;
  }

  public long getSent() {
    return sent;
  }

  public long getFailed() {
    return failed;
  }

  /**
   * @return Время последней успешной отправки или {@code null}, если отправок ещё не было.
   */
  public Instant getLastSendTimestamp() {
    return lastSendTimestamp;
  }

  @Override
  public String toString() {
    return "DeliveryStats{sent=" + sent + ", failed=" + failed + ", lastSend=" + lastSendTimestamp + '}';
  }
}
