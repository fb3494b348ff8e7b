package dev.orderscanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable newest-first ring of status lines. Pushing past capacity drops
 * the oldest line.
 */
public final class BoundedLog {

    private final int capacity;
    private final List<String> lines;

    private BoundedLog(int capacity, List<String> lines) {
        this.capacity = capacity;
        this.lines = lines;
    }

    public static BoundedLog empty(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Log capacity must be positive: " + capacity);
        }
        return new BoundedLog(capacity, List.of());
    }

    public BoundedLog push(String line) {
        int size = Math.min(lines.size() + 1, capacity);
        List<String> next = new ArrayList<>(size);
        next.add(line);
        next.addAll(lines.subList(0, size - 1));
        return new BoundedLog(capacity, Collections.unmodifiableList(next));
    }

    public int size() {
        return lines.size();
    }

    public String newest() {
        return lines.isEmpty() ? null : lines.get(0);
    }

    @JsonValue
    public List<String> asList() {
        return lines;
    }

    @Override
    public String toString() {
        return lines.toString();
    }
}
