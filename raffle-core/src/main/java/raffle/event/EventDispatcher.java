package raffle.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes events to listeners through a table fixed at build time.
 *
 * <p>Listeners for a type are invoked in registration order. There is no registration after
 * {@link Builder#build()}; the table is an immutable {@link EnumMap}, so publishing needs no
 * locking.
 *
 * <pre>{@code
 * EventDispatcher events = EventDispatcher.builder()
 *     .on(EventType.DRAW_COMPLETED, event -> announce((RaffleEvent.DrawCompleted) event))
 *     .build();
 * }</pre>
 */
public final class EventDispatcher {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  /** Dispatcher with no listeners. */
  public static final EventDispatcher NONE = builder().build();

  private final Map<EventType, List<EventListener>> table;

  private EventDispatcher(Map<EventType, List<EventListener>> table) {
    this.table = table;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers the event to every listener registered for its type.
   *
   * @return the number of listeners that completed without throwing
   */
  public int publish(RaffleEvent event) {
    Objects.requireNonNull(event, "event");
    List<EventListener> listeners = table.get(event.type());
    if (listeners == null) {
      return 0;
    }
    int delivered = 0;
    for (EventListener listener : listeners) {
      try {
        listener.onEvent(event);
        delivered++;
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Listener failed for " + event.type(), e);
      }
    }
    return delivered;
  }

  public int listenerCount(EventType type) {
    List<EventListener> listeners = table.get(type);
    return listeners == null ? 0 : listeners.size();
  }

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private final Map<EventType, List<EventListener>> listeners = new EnumMap<>(EventType.class);

    private Builder() {}

    /**
     * Registers a listener for one event type.
     *
     * @param type     the event type
     * @param listener the listener
     * @return this builder
     */
    public Builder on(EventType type, EventListener listener) {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(listener, "listener");
      listeners.computeIfAbsent(type, t -> new ArrayList<>()).add(listener);
      return this;
    }

    /**
     * Registers a listener for every event type.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder onAll(EventListener listener) {
      for (EventType type : EventType.values()) {
        on(type, listener);
      }
      return this;
    }

    public EventDispatcher build() {
      Map<EventType, List<EventListener>> table = new EnumMap<>(EventType.class);
      listeners.forEach((type, list) -> table.put(type, List.copyOf(list)));
      return new EventDispatcher(Collections.unmodifiableMap(table));
    }
  }
}
