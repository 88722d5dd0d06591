package io.mhm.core.dispatch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Single-threaded cooperative scheduler that runs all asynchronous bot activity.
 *
 * <p>{@link #submit(AsyncWork)} is the only method meant to be called from foreign threads.
 * Continuations that must run on the loop can use the loop itself as an {@link Executor}.
 */
public interface EventLoop extends Executor {
    boolean isClosed();

    boolean inEventLoop();

    /**
     * Hands {@code work} to the loop thread.
     *
     * @throws java.util.concurrent.RejectedExecutionException when the loop no longer accepts work
     */
    <T> CompletableFuture<T> submit(AsyncWork<T> work);

    /**
     * Returns a stage completed on the loop thread after {@code delay}, without blocking the loop.
     */
    CompletableFuture<Void> sleep(Duration delay);
}
