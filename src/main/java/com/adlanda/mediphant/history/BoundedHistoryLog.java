package com.adlanda.mediphant.history;

import com.adlanda.mediphant.model.HistoryItem;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Most-recent-first log of interaction checks, capped at a fixed size.
 *
 * Adding beyond the cap evicts the oldest items.
 */
public class BoundedHistoryLog {

    public static final int DEFAULT_CAPACITY = 10;

    private final Deque<HistoryItem> items = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;

    public BoundedHistoryLog(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized void add(HistoryItem item) {
        items.addFirst(item);
        while (items.size() > capacity) {
            items.removeLast();
        }
    }

    /**
     * Creates an item stamped with the current time and adds it.
     */
    public HistoryItem record(String medA, String medB, boolean risky, String reason) {
        HistoryItem item = new HistoryItem(UUID.randomUUID().toString(), medA, medB, risky, reason, clock.instant());
        add(item);
        return item;
    }

    /**
     * Snapshot of the log, newest first. Changes to the log do not show up in it.
     */
    public synchronized List<HistoryItem> list() {
        return List.copyOf(items);
    }

    public synchronized void clear() {
        items.clear();
    }

    public synchronized int size() {
        return items.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
