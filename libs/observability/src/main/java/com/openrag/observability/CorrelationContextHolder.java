package com.openrag.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys declared on {@link CorrelationContext}; clearing it
 * removes them. Servlet containers reuse threads, so whoever sets a context must clear it.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        setMdc(CorrelationContext.MDC_USER_ID, context.userId());
        setMdc(CorrelationContext.MDC_AUTH_METHOD, context.authMethod());
    }

    /** Returns the current thread's correlation context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Records the authenticated caller on the current context. No-op when no context is set
     * (e.g. unit tests that bypass the correlation filter).
     */
    public static void attachUser(String userId, String authMethod) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withUser(userId, authMethod));
        }
    }

    /** Clears the correlation context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_AUTH_METHOD);
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
