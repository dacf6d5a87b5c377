package com.openrag.authservice.domain;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process store of pending OAuth connections.
 *
 * <p>{@link #consume(PendingConnection)} is a compare-and-remove, so of two concurrent callbacks
 * for the same connection exactly one wins.
 */
public class PendingConnectionStore {

    private final ConcurrentMap<String, PendingConnection> pending = new ConcurrentHashMap<>();

    public void put(PendingConnection connection) {
        pending.put(connection.connectionId(), connection);
    }

    public Optional<PendingConnection> find(String connectionId) {
        return Optional.ofNullable(pending.get(connectionId));
    }

    /** Removes {@code connection} if it is still pending. */
    public boolean consume(PendingConnection connection) {
        return pending.remove(connection.connectionId(), connection);
    }

    /** Drops every entry expired at {@code now}; returns how many were dropped. */
    public int purgeExpired(Instant now) {
        int before = pending.size();
        pending.values().removeIf(connection -> connection.isExpired(now));
        return Math.max(0, before - pending.size());
    }

    public int size() {
        return pending.size();
    }
}
