package org.carball.profiler.profiler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value counts with a hard cap on distinct keys. Once a new key arrives at a full table
 * the table is {@link State#OVERFLOWED} for good: known keys keep counting, unseen keys
 * are dropped.
 */
public class FrequencyTable {

    public enum State {
        OPEN,
        OVERFLOWED
    }

    private final int capacity;
    private final Map<String, Long> counts = new LinkedHashMap<>();
    private State state = State.OPEN;

    public FrequencyTable(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Frequency table capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void record(String key) {
        Long count = counts.get(key);
        if (count != null) {
            counts.put(key, count + 1);
            return;
        }

        if (state == State.OVERFLOWED) {
            return;
        }
        if (counts.size() >= capacity) {
            state = State.OVERFLOWED;
            return;
        }
        counts.put(key, 1L);
    }

    public boolean isOverflowed() {
        return state == State.OVERFLOWED;
    }

    public State getState() {
        return state;
    }

    public int size() {
        return counts.size();
    }

    public long countOf(String key) {
        return counts.getOrDefault(key, 0L);
    }

    /**
     * Entries by descending count; equal counts keep insertion order.
     */
    public List<Map.Entry<String, Long>> mostFrequent(int limit) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        return entries.subList(0, Math.min(limit, entries.size()));
    }
}
