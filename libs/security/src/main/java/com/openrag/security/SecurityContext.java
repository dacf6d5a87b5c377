package com.openrag.security;

import java.util.AbstractMap;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Ambient identity and retrieval scoping for the current unit of work.
 * <p>
 * Each thread holds one immutable {@link SecurityContextSnapshot}. The setters replace the
 * snapshot for the current scope only:
 * <ul>
 *   <li>{@link #runInScope(Runnable)} / {@link #callInScope(Callable)} open a nested scope; whatever
 *       the nested work sets is discarded when it returns, so callers never see it.</li>
 *   <li>{@link #wrap(Runnable)} captures the snapshot at spawn time and installs it on whichever
 *       thread runs the task, then restores that thread's previous snapshot. Sibling tasks each
 *       start from the parent's snapshot and never observe each other's overrides.</li>
 * </ul>
 * The request boundary ({@code RequestAuthGuard}, {@code TransportAuthGate}) opens a scope with
 * {@link #open(SecurityContextSnapshot)} and closes it when the request completes, so pooled
 * worker threads never carry one request's identity into the next.
 */
public final class SecurityContext {

    private static final ThreadLocal<SecurityContextSnapshot> CURRENT = new ThreadLocal<>();

    private SecurityContext() {
        // utility class
    }

    /** Restores the snapshot that was current when the scope was opened. */
    public static final class Scope implements AutoCloseable {

        private final SecurityContextSnapshot previous;
        private final Thread owner;
        private boolean closed;

        private Scope(SecurityContextSnapshot previous) {
            this.previous = previous;
            this.owner = Thread.currentThread();
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (Thread.currentThread() != owner) {
                throw new IllegalStateException("SecurityContext scope closed on a different thread");
            }
            closed = true;
            restore(previous);
        }
    }

    /** Snapshot of the current scope, {@link SecurityContextSnapshot#EMPTY} when nothing is set. */
    public static SecurityContextSnapshot current() {
        SecurityContextSnapshot snapshot = CURRENT.get();
        return snapshot != null ? snapshot : SecurityContextSnapshot.EMPTY;
    }

    /**
     * Installs {@code snapshot} until the returned scope is closed.
     */
    public static Scope open(SecurityContextSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Scope scope = new Scope(CURRENT.get());
        CURRENT.set(snapshot);
        return scope;
    }

    /** Sets the caller identity for the current scope. Null collections mean "none". */
    public static void set(String userId, String jwtToken, Collection<String> groups, Collection<String> roles) {
        CURRENT.set(current().withIdentity(userId, jwtToken, groups, roles));
    }

    public static void setSearchFilters(Map<String, Object> filters) {
        CURRENT.set(current().withSearchFilters(filters));
    }

    public static void setSearchLimit(int limit) {
        CURRENT.set(current().withSearchLimit(limit));
    }

    public static void setScoreThreshold(double threshold) {
        CURRENT.set(current().withScoreThreshold(threshold));
    }

    public static String getCurrentUserId() {
        return current().userId();
    }

    public static String getCurrentJwtToken() {
        return current().jwtToken();
    }

    public static List<String> getCurrentUserGroups() {
        return current().groups();
    }

    public static List<String> getCurrentUserRoles() {
        return current().roles();
    }

    /** Current {@code (userId, jwtToken)} pair. */
    public static Map.Entry<String, String> getAuthContext() {
        SecurityContextSnapshot snapshot = current();
        return new AbstractMap.SimpleImmutableEntry<>(snapshot.userId(), snapshot.jwtToken());
    }

    public static Map<String, Object> getSearchFilters() {
        return current().searchFilters();
    }

    public static int getSearchLimit() {
        return current().searchLimit();
    }

    public static double getScoreThreshold() {
        return current().scoreThreshold();
    }

    /** Runs {@code work} in a nested scope; its overrides are discarded on return. */
    public static void runInScope(Runnable work) {
        runWith(current(), work);
    }

    /** Calls {@code work} in a nested scope; its overrides are discarded on return. */
    public static <T> T callInScope(Callable<T> work) throws Exception {
        return callWith(current(), work);
    }

    /** Runs {@code work} with {@code snapshot} installed, then restores the previous one. */
    public static void runWith(SecurityContextSnapshot snapshot, Runnable work) {
        try (Scope ignored = open(snapshot)) {
            work.run();
        }
    }

    /** Calls {@code work} with {@code snapshot} installed, then restores the previous one. */
    public static <T> T callWith(SecurityContextSnapshot snapshot, Callable<T> work) throws Exception {
        try (Scope ignored = open(snapshot)) {
            return work.call();
        }
    }

    /** Binds {@code task} to the snapshot current at the time of this call. */
    public static Runnable wrap(Runnable task) {
        SecurityContextSnapshot captured = current();
        return () -> runWith(captured, task);
    }

    /** Binds {@code task} to the snapshot current at the time of this call. */
    public static <T> Callable<T> wrap(Callable<T> task) {
        SecurityContextSnapshot captured = current();
        return () -> callWith(captured, task);
    }

    /** Binds {@code supplier} to the snapshot current at the time of this call. */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> supplier) {
        SecurityContextSnapshot captured = current();
        return () -> {
            try (Scope ignored = open(captured)) {
                return supplier.get();
            }
        };
    }

    /** Ends the request scope on this thread. */
    public static void clear() {
        CURRENT.remove();
    }

    private static void restore(SecurityContextSnapshot previous) {
        if (previous != null) {
            CURRENT.set(previous);
        } else {
            CURRENT.remove();
        }
    }
}
