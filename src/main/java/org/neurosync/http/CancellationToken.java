package org.neurosync.http;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cooperative cancellation signal shared between a caller and the operations it started.
 * <p>
 * Cancelling aborts outstanding network calls and completes the affected futures with
 * {@link CancellationException}, which callers must treat as distinct from both success and
 * failure.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * @return a new token that can be cancelled
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * @return the shared token that is never cancelled
     */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancels the token and runs every registered listener once.
     *
     * @throws IllegalStateException for {@link #none()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("The uncancellable token cannot be cancelled");
        }
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        listeners.clear();
    }

    /**
     * Registers a listener; runs it immediately if the token is already cancelled.
     *
     * @return a handle that unregisters the listener
     */
    public Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return () -> { };
        }
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> listeners.remove(listener);
            }
        }
        listener.run();
        return () -> { };
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * Cancels {@code future} when this token is cancelled, for as long as the future is pending.
     *
     * @return {@code future}
     */
    public <T> CompletableFuture<T> bind(CompletableFuture<T> future) {
        if (!cancellable) {
            return future;
        }
        Registration registration = onCancel(() -> future.cancel(true));
        future.whenComplete((value, error) -> registration.remove());
        return future;
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
