package com.vehicle.anomaly.engine;

import com.vehicle.anomaly.model.HistoryEntry;
import com.vehicle.anomaly.model.TelemetrySample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded per-session ring buffers of recent samples.
 *
 * Every buffer has its own lock. Appends and snapshots of a session are
 * serialized on it; different sessions never contend. The stale-session sweep
 * takes the same lock and retires the buffer before unmapping it, so an append
 * racing with the sweep either lands before the check or starts a new buffer.
 */
public class SessionHistoryStore {

    private final int capacity;
    private final Map<String, SessionBuffer> buffers = new ConcurrentHashMap<>();

    public SessionHistoryStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a sample, evicting the oldest entry when the buffer is full.
     *
     * @return snapshot of the session buffer after the append, oldest first
     */
    public List<HistoryEntry> append(String sessionId, TelemetrySample sample, Instant timestamp) {
        HistoryEntry entry = new HistoryEntry(sample, timestamp);
        while (true) {
            SessionBuffer buffer = buffers.computeIfAbsent(sessionId, id -> new SessionBuffer());
            buffer.lock.lock();
            try {
                if (buffer.retired) {
                    // Swept between lookup and lock; retry on a fresh buffer
                    continue;
                }
                if (buffer.entries.size() == capacity) {
                    buffer.entries.removeFirst();
                }
                buffer.entries.addLast(entry);
                return buffer.snapshot();
            } finally {
                buffer.lock.unlock();
            }
        }
    }

    /**
     * @return copy of the session buffer, oldest first; empty for unknown sessions
     */
    public List<HistoryEntry> snapshot(String sessionId) {
        SessionBuffer buffer = buffers.get(sessionId);
        if (buffer == null) {
            return Collections.emptyList();
        }
        buffer.lock.lock();
        try {
            return buffer.retired ? Collections.emptyList() : buffer.snapshot();
        } finally {
            buffer.lock.unlock();
        }
    }

    public int size(String sessionId) {
        return snapshot(sessionId).size();
    }

    public int sessionCount() {
        return buffers.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Remove every session whose most recent entry is older than {@code now - maxAge}.
     *
     * @return number of sessions removed
     */
    public int evictStale(Duration maxAge, Instant now) {
        Instant cutoff = now.minus(maxAge);
        int removed = 0;
        for (Map.Entry<String, SessionBuffer> mapping : buffers.entrySet()) {
            SessionBuffer buffer = mapping.getValue();
            buffer.lock.lock();
            try {
                HistoryEntry newest = buffer.entries.peekLast();
                if (!buffer.retired && (newest == null || newest.getTimestamp().isBefore(cutoff))) {
                    buffer.retired = true;
                    buffers.remove(mapping.getKey(), buffer);
                    removed++;
                }
            } finally {
                buffer.lock.unlock();
            }
        }
        return removed;
    }

    private static final class SessionBuffer {
        private final ReentrantLock lock = new ReentrantLock();
        private final ArrayDeque<HistoryEntry> entries = new ArrayDeque<>();
        private boolean retired;

        private List<HistoryEntry> snapshot() {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        }
    }
}
