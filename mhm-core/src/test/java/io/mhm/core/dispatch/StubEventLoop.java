package io.mhm.core.dispatch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Loop whose state the test controls. Never runs submitted work.
 */
final class StubEventLoop implements EventLoop {
    private final boolean closed;
    private final boolean rejectSubmissions;
    AsyncWork<?> lastSubmitted;
    int submissions;

    StubEventLoop(boolean closed, boolean rejectSubmissions) {
        this.closed = closed;
        this.rejectSubmissions = rejectSubmissions;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean inEventLoop() {
        return false;
    }

    @Override
    public <T> CompletableFuture<T> submit(AsyncWork<T> work) {
        submissions++;
        lastSubmitted = work;
        if (rejectSubmissions) {
            throw new RejectedExecutionException("event loop closed");
        }
        return new CompletableFuture<>();
    }

    @Override
    public CompletableFuture<Void> sleep(Duration delay) {
        return new CompletableFuture<>();
    }

    @Override
    public void execute(Runnable command) {
        throw new RejectedExecutionException("stub loop does not run work");
    }
}
