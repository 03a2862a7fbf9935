package com.shadowhunters.engine.event;

import java.util.ArrayList;
import java.util.List;

/**
 * Synchronous, ordered event delivery.
 * Listeners run in subscription order; nested publishes are delivered
 * depth-first.
 */
public class EventBus {
    private final List<GameEventListener> listeners = new ArrayList<>();

    public void subscribe(GameEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(GameEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(GameEvent event) {
        // Copy: a listener may subscribe or unsubscribe during delivery
        for (GameEventListener listener : List.copyOf(listeners)) {
            listener.onEvent(event);
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
