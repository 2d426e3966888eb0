package raffle.jdbc;

import raffle.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

class CountingMetrics implements MetricsExporter {
  final AtomicInteger busyRetries = new AtomicInteger();
  final AtomicInteger drawsCompleted = new AtomicInteger();
  final AtomicInteger drawsRejected = new AtomicInteger();
  final AtomicInteger deliveries = new AtomicInteger();

  @Override
  public void incrementDrawCompleted() {
    drawsCompleted.incrementAndGet();
  }

  @Override
  public void incrementDrawRejected() {
    drawsRejected.incrementAndGet();
  }

  @Override
  public void incrementDeliverySuccess() {
    deliveries.incrementAndGet();
  }

  @Override
  public void incrementDeliveryRetry() {}

  @Override
  public void incrementDeliveryFailed() {}

  @Override
  public void incrementDeliveryThrottled() {}

  @Override
  public void incrementBusyRetry() {
    busyRetries.incrementAndGet();
  }
}
