package raffle.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a single send through a {@link DeliveryChannel}.
 *
 * <ul>
 *   <li>{@link Delivered}: the message reached the recipient</li>
 *   <li>{@link Failed}: the send failed and counts as one attempt</li>
 *   <li>{@link Throttled}: the transport asked to slow down; the attempt does not count</li>
 * </ul>
 */
public sealed interface DeliveryOutcome
    permits DeliveryOutcome.Delivered, DeliveryOutcome.Failed, DeliveryOutcome.Throttled {

  static DeliveryOutcome delivered() {
    return Delivered.INSTANCE;
  }

  static DeliveryOutcome failed(String reason) {
    return new Failed(reason);
  }

  static DeliveryOutcome throttled(Duration retryAfter) {
    return new Throttled(retryAfter);
  }

  /** Successful delivery. */
  final class Delivered implements DeliveryOutcome {
    static final Delivered INSTANCE = new Delivered();

    private Delivered() {}

    @Override
    public String toString() {
      return "Delivered";
    }
  }

  /** Failed delivery. */
  record Failed(String reason) implements DeliveryOutcome {
    public Failed {
      reason = reason == null ? "unknown" : reason;
    }
  }

  /** Rate limit signaled by the transport. */
  record Throttled(Duration retryAfter) implements DeliveryOutcome {
    public Throttled {
      Objects.requireNonNull(retryAfter, "retryAfter");
      if (retryAfter.isNegative()) {
        throw new IllegalArgumentException("retryAfter must be >= 0, got: " + retryAfter);
      }
    }
  }
}
