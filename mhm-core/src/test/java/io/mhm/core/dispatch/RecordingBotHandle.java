package io.mhm.core.dispatch;

import io.mhm.core.welcome.WelcomeView;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Bot handle that records what it was asked to do. Each send completes with whatever
 * {@code sendResult} supplies.
 */
public final class RecordingBotHandle implements BotHandle {
    public record SentMessage(String externalId, String text, WelcomeView view) {
    }

    private final EventLoop loop;
    private final Supplier<CompletableFuture<Void>> sendResult;
    private final List<String> fetched = new CopyOnWriteArrayList<>();
    private final List<SentMessage> sent = new CopyOnWriteArrayList<>();

    public RecordingBotHandle(EventLoop loop) {
        this(loop, () -> CompletableFuture.completedFuture(null));
    }

    public RecordingBotHandle(EventLoop loop, Supplier<CompletableFuture<Void>> sendResult) {
        this.loop = loop;
        this.sendResult = sendResult;
    }

    @Override
    public EventLoop eventLoop() {
        return loop;
    }

    @Override
    public CompletionStage<UserHandle> fetchUser(String externalId) {
        fetched.add(externalId);
        return CompletableFuture.completedFuture(new UserHandle() {
            @Override
            public String externalId() {
                return externalId;
            }

            @Override
            public CompletionStage<Void> send(String text, WelcomeView view) {
                sent.add(new SentMessage(externalId, text, view));
                return sendResult.get();
            }
        });
    }

    public List<String> fetched() {
        return fetched;
    }

    public List<SentMessage> sent() {
        return sent;
    }
}
