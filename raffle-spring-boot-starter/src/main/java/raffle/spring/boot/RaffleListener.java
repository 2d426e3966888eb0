package raffle.spring.boot;

import raffle.event.EventType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts an {@link raffle.event.EventListener} bean to the given event types.
 *
 * <p>Listener beans without this annotation, or with an empty {@link #value()}, receive
 * every event. Listener beans are created before the raffle beans, so they must not
 * inject {@link raffle.Raffle} or its components.
 *
 * <pre>{@code
 * @Component
 * @RaffleListener(EventType.DRAW_COMPLETED)
 * public class WinnerAnnouncer implements EventListener {
 *   @Override
 *   public void onEvent(RaffleEvent event) { ... }
 * }
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RaffleListener {

  EventType[] value() default {};
}
