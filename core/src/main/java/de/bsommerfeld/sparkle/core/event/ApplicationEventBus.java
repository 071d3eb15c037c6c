package de.bsommerfeld.sparkle.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide wrapper around Guava's {@link EventBus}. The store posts
 * commit notifications here and live queries listen for them.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A subscriber that throws is
 * logged and does not affect other subscribers or the poster.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.trace("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable error, SubscriberExceptionContext context) {
        LOG.warn("Subscriber {} failed on event {}",
                context.getSubscriberMethod().getName(), context.getEvent(), error);
    }
}
