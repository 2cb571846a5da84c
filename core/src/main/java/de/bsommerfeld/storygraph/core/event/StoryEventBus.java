package de.bsommerfeld.storygraph.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus}. The graph engine posts
 * {@link StoryEvents} here so subsystems keyed by snippet id (lorebooks,
 * per-story settings) can follow deletions and duplications without the
 * engine knowing about them.
 *
 * <p>
 * Delivery is synchronous on the posting thread. Subscriber exceptions are
 * logged by Guava and never reach the poster.
 */
@Singleton
public class StoryEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(StoryEventBus.class);
    private final EventBus eventBus;

    public StoryEventBus() {
        this.eventBus = new EventBus("StoryGraph-EventBus");
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
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
}
