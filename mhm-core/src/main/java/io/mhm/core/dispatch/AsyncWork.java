package io.mhm.core.dispatch;

import java.util.concurrent.CompletionStage;

/**
 * A unit of asynchronous work started on an {@link EventLoop} thread.
 */
@FunctionalInterface
public interface AsyncWork<T> {
    CompletionStage<T> start(EventLoop loop);
}
