package com.satfetch.events;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe, synchronous fan-out of progress events to subscribed listeners.
 * <p>
 * Listeners are called in registration order on the emitting thread. Each emission dispatches
 * to the listener list as it was when {@link #emit(ProgressEvent)} was entered, so listeners
 * may subscribe or unsubscribe (themselves included) while events are being dispatched.
 * A listener that throws is logged and skipped; the remaining listeners still receive the event.
 */
@Slf4j
public class EventBus implements EventSink {

    private final Object lock = new Object();
    private final List<ProgressListener> listeners = new ArrayList<>();

    public void subscribe(ProgressListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        synchronized (lock) {
            listeners.add(listener);
        }
    }

    public boolean unsubscribe(ProgressListener listener) {
        synchronized (lock) {
            for (int i = 0; i < listeners.size(); i++) {
                if (listeners.get(i) == listener) {
                    listeners.remove(i);
                    return true;
                }
            }
        }
        return false;
    }

    public int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    @Override
    public void emit(ProgressEvent event) {
        List<ProgressListener> snapshot;
        synchronized (lock) {
            snapshot = List.copyOf(listeners);
        }
        for (ProgressListener listener : snapshot) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed on {} for {}: {}",
                        listener.getClass().getSimpleName(), event.type(), event.taskId(), e.getMessage(), e);
            }
        }
    }
}
