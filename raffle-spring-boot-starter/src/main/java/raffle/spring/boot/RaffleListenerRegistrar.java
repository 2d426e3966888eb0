package raffle.spring.boot;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.annotation.AnnotationUtils;
import raffle.event.EventDispatcher;
import raffle.event.EventListener;
import raffle.event.EventType;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Collects every {@link EventListener} bean into an {@link EventDispatcher}.
 *
 * <p>The dispatch table is fixed once built, so listeners are gathered a single time when
 * the dispatcher bean is created. A {@link RaffleListener} annotation narrows a listener to
 * its event types.
 *
 * @see RaffleListener
 */
public class RaffleListenerRegistrar {
    private static final Logger logger = Logger.getLogger(RaffleListenerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;

    public RaffleListenerRegistrar(ListableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    public EventDispatcher buildDispatcher() {
        EventDispatcher.Builder builder = EventDispatcher.builder();
        Map<String, EventListener> beans = beanFactory.getBeansOfType(EventListener.class);
        for (Map.Entry<String, EventListener> entry : beans.entrySet()) {
            EventListener listener = entry.getValue();
            // Proxies may hide the annotation on the target class
            RaffleListener annotation =
                    AnnotationUtils.findAnnotation(listener.getClass(), RaffleListener.class);
            if (annotation == null || annotation.value().length == 0) {
                builder.onAll(listener);
            } else {
                for (EventType type : annotation.value()) {
                    builder.on(type, listener);
                }
            }
            logger.fine("Registered raffle event listener bean '" + entry.getKey() + "'");
        }
        return builder.build();
    }
}
