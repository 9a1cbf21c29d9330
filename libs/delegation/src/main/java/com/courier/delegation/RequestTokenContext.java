package com.courier.delegation;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Thread-local holder for the inbound caller's bearer token.
 * <p>
 * The ingress filter (or gRPC interceptor) sets the slot once per request before the request is
 * handled; downstream code reads it through {@link #getCurrentToken()} whenever it needs to act on
 * behalf of the caller. Each thread owns its own slot, so one request can never observe the token of
 * another in-flight request.
 * <p>
 * Work handed to a thread pool does not see the slot automatically. Callers must transfer it
 * explicitly with {@link #wrap(Runnable)}, {@link #wrap(Supplier)} or
 * {@link #runWithToken(String, Runnable)}.
 */
public final class RequestTokenContext {

    private static final ThreadLocal<String> CURRENT_TOKEN = new ThreadLocal<>();

    private RequestTokenContext() {
        // utility class
    }

    /**
     * Sets the bearer token for the current thread. A {@code null} or blank token marks the slot
     * as absent; it still overwrites whatever value the thread held before.
     *
     * @param token the caller's bearer token, or null when the request carried none
     */
    public static void setCurrentToken(String token) {
        if (token == null || token.isBlank()) {
            CURRENT_TOKEN.remove();
        } else {
            CURRENT_TOKEN.set(token);
        }
    }

    /**
     * Returns the current thread's bearer token, if one was captured for this request.
     */
    public static Optional<String> getCurrentToken() {
        return Optional.ofNullable(CURRENT_TOKEN.get());
    }

    /**
     * Removes the token from the current thread.
     */
    public static void clear() {
        CURRENT_TOKEN.remove();
    }

    /**
     * Executes a {@link Runnable} with the given token bound, then restores the previous value
     * (or clears the slot if there was none).
     *
     * @param token    the token for the duration of the runnable (may be null)
     * @param runnable the work to execute
     */
    public static void runWithToken(String token, Runnable runnable) {
        String previous = CURRENT_TOKEN.get();
        try {
            setCurrentToken(token);
            runnable.run();
        } finally {
            setCurrentToken(previous);
        }
    }

    /**
     * Executes a {@link Callable} with the given token bound and returns its result, restoring the
     * previous value afterwards.
     *
     * @param token    the token for the duration of the call (may be null)
     * @param callable the work to execute
     * @param <T>      result type
     * @return the callable's result
     * @throws Exception whatever the callable throws
     */
    public static <T> T callWithToken(String token, Callable<T> callable) throws Exception {
        String previous = CURRENT_TOKEN.get();
        try {
            setCurrentToken(token);
            return callable.call();
        } finally {
            setCurrentToken(previous);
        }
    }

    /**
     * Unchecked variant of {@link #callWithToken(String, Callable)}.
     *
     * @param token    the token for the duration of the call (may be null)
     * @param supplier the work to execute
     * @param <T>      result type
     * @return the supplier's result
     */
    public static <T> T supplyWithToken(String token, Supplier<T> supplier) {
        String previous = CURRENT_TOKEN.get();
        try {
            setCurrentToken(token);
            return supplier.get();
        } finally {
            setCurrentToken(previous);
        }
    }

    /**
     * Captures the current thread's token and returns a runnable that re-binds it on whichever
     * thread eventually runs the task.
     *
     * @param task the task to hand off
     * @return a runnable carrying the captured token
     */
    public static Runnable wrap(Runnable task) {
        String captured = CURRENT_TOKEN.get();
        return () -> runWithToken(captured, task);
    }

    /**
     * Supplier variant of {@link #wrap(Runnable)}, convenient with
     * {@code CompletableFuture.supplyAsync}.
     *
     * @param task the task to hand off
     * @param <T>  result type
     * @return a supplier carrying the captured token
     */
    public static <T> Supplier<T> wrap(Supplier<T> task) {
        String captured = CURRENT_TOKEN.get();
        return () -> supplyWithToken(captured, task);
    }
}
