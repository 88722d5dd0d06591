package io.mhm.core.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLoop} backed by one named daemon thread. Closing stops intake of new work; work
 * already queued, including pending sleeps, still runs before the thread exits.
 */
public final class SingleThreadEventLoop implements EventLoop, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SingleThreadEventLoop.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    public SingleThreadEventLoop(String name) {
        Objects.requireNonNull(name, "name must not be null");
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(true);
    }

    @Override
    public boolean isClosed() {
        return executor.isShutdown();
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public <T> CompletableFuture<T> submit(AsyncWork<T> work) {
        Objects.requireNonNull(work, "work must not be null");
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                work.start(this).whenComplete((value, error) -> {
                    if (error != null) {
                        result.completeExceptionally(error);
                    } else {
                        result.complete(value);
                    }
                });
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<Void> sleep(Duration delay) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        long millis = delay == null ? 0 : Math.max(0, delay.toMillis());
        executor.schedule(() -> done.complete(null), millis, TimeUnit.MILLISECONDS);
        return done;
    }

    @Override
    public void execute(Runnable command) {
        executor.execute(command);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Event loop did not drain within {}; abandoning pending work", SHUTDOWN_GRACE);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
