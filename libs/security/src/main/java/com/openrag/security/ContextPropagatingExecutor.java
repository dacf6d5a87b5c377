package com.openrag.security;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Executor decorator that hands each task the {@link SecurityContext} snapshot of the thread
 * that submitted it.
 */
public final class ContextPropagatingExecutor implements Executor {

    private final Executor delegate;

    public ContextPropagatingExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(SecurityContext.wrap(command));
    }
}
