package com.uptime.keeper.monitor.notify;

import com.uptime.keeper.config.KeeperProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps the most recent events in memory for the status API, newest first.
 */
@Component
public class RecentEventsBuffer implements MonitorEventListener {
    private final int capacity;
    private final Deque<MonitorEvent> events = new ArrayDeque<>();

    public RecentEventsBuffer(KeeperProperties properties) {
        this.capacity = properties.getNotifier().getRecentEventsLimit();
    }

    @Override
    public synchronized void onEvent(MonitorEvent event) {
        events.addFirst(event);
        while (events.size() > capacity) {
            events.removeLast();
        }
    }

    public synchronized List<MonitorEvent> recent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, capacity));
        List<MonitorEvent> result = new ArrayList<>(Math.min(safeLimit, events.size()));
        Iterator<MonitorEvent> iterator = events.iterator();
        while (iterator.hasNext() && result.size() < safeLimit) {
            result.add(iterator.next());
        }
        return result;
    }
}
