package com.threatsentinel.core.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe registry keyed by {@link Topic}.
 *
 * <p>
 * Delivery is synchronous on the publishing thread, in subscription order.
 * A listener that throws is logged; the remaining listeners still receive
 * the payload and the publisher is unaffected.
 * </p>
 *
 * @since 1.0.0
 */
public class SecurityEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(SecurityEventBus.class);

    private final Map<String, List<Consumer<Object>>> listeners = new ConcurrentHashMap<>();

    /**
     * @return a handle that removes exactly this registration
     */
    @SuppressWarnings("unchecked")
    public <T> Subscription subscribe(Topic<T> topic, Consumer<? super T> listener) {
        Objects.requireNonNull(topic, "Topic must not be null");
        Objects.requireNonNull(listener, "Listener must not be null");
        Consumer<Object> registered = payload -> listener.accept((T) payload);
        List<Consumer<Object>> topicListeners = listeners.computeIfAbsent(topic.getName(),
                name -> new CopyOnWriteArrayList<>());
        topicListeners.add(registered);
        LOG.debug("Subscribed listener to '{}'", topic);
        return () -> {
            if (topicListeners.remove(registered)) {
                LOG.debug("Unsubscribed listener from '{}'", topic);
            }
        };
    }

    public <T> void publish(Topic<T> topic, T payload) {
        Objects.requireNonNull(topic, "Topic must not be null");
        Objects.requireNonNull(payload, "Payload must not be null");
        List<Consumer<Object>> topicListeners = listeners.get(topic.getName());
        if (topicListeners == null) {
            return;
        }
        for (Consumer<Object> listener : topicListeners) {
            try {
                listener.accept(payload);
            } catch (RuntimeException e) {
                LOG.error("Listener on '{}' failed", topic, e);
            }
        }
    }

    /**
     * @return number of listeners currently registered on the topic
     */
    public int listenerCount(Topic<?> topic) {
        List<Consumer<Object>> topicListeners = listeners.get(topic.getName());
        return topicListeners == null ? 0 : topicListeners.size();
    }
}
