package raffle.event;

/**
 * Receives {@link RaffleEvent}s from an {@link EventDispatcher}.
 *
 * <p>Listeners run on the emitting thread. Exceptions are logged by the dispatcher and do
 * not reach the emitting component.
 */
@FunctionalInterface
public interface EventListener {

  void onEvent(RaffleEvent event);
}
