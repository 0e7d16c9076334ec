package com.uptime.keeper.monitor.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans events out to every {@link MonitorEventListener} on the notifier executor.
 */
@Component
public class EventDispatcher implements MonitorNotifier {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<MonitorEventListener> listeners;
    private final ExecutorService executor;

    public EventDispatcher(
        List<MonitorEventListener> listeners,
        @Qualifier("notifierExecutor") ExecutorService executor
    ) {
        this.listeners = List.copyOf(listeners);
        this.executor = executor;
    }

    @Override
    public void publish(MonitorEvent event) {
        if (event == null) {
            return;
        }
        for (MonitorEventListener listener : listeners) {
            try {
                executor.execute(() -> deliver(listener, event));
            } catch (RejectedExecutionException e) {
                log.debug("Dropping {} for {}: notifier is shut down", event.type(), event.targetId());
            }
        }
    }

    private void deliver(MonitorEventListener listener, MonitorEvent event) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            log.warn(
                "Listener {} failed to handle {} for {}",
                listener.getClass().getSimpleName(),
                event.type(),
                event.targetId(),
                e
            );
        }
    }
}
