package io.mhm.core.dispatch;

import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.WelcomeStore;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands welcome DMs from the HTTP thread to the bot's event loop.
 *
 * <p>{@link #dispatchNotification} never blocks on delivery: {@code true} means the task was
 * accepted by the loop, not that the user received anything.
 */
public final class WelcomeDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(WelcomeDispatcher.class);
    public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(1);

    private final WelcomeStore store;
    private final DispatchFailurePolicy failurePolicy;
    private final Duration settleDelay;

    public WelcomeDispatcher(WelcomeStore store, DispatchFailurePolicy failurePolicy, Duration settleDelay) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
        this.settleDelay = settleDelay == null ? DEFAULT_SETTLE_DELAY : settleDelay;
    }

    public boolean dispatchNotification(ExternalUser user, BotHandle bot) {
        if (bot == null) {
            failurePolicy.onUndispatchable(user, "bot handle not available", null);
            return false;
        }
        EventLoop loop = bot.eventLoop();
        if (loop == null) {
            failurePolicy.onUndispatchable(user, "bot event loop not available", null);
            return false;
        }
        if (loop.isClosed()) {
            failurePolicy.onUndispatchable(user, "bot event loop is closed", null);
            return false;
        }

        WelcomeTask task = new WelcomeTask(user, bot, store, settleDelay);
        boolean submitted = false;
        try {
            CompletableFuture<Boolean> handle = loop.submit(task);
            task.markSubmitted();
            submitted = true;
            LOG.info("Scheduled welcome DM for {} user {}", user.channelType(), user.externalId());
            handle.exceptionally(error -> {
                LOG.error("Welcome task for {} user {} ended abnormally", user.channelType(), user.externalId(), error);
                return false;
            });
            return true;
        } catch (RuntimeException e) {
            // the loop can close between the isClosed() check and submit()
            failurePolicy.onUndispatchable(user, "event loop rejected the welcome task", e);
            return false;
        } finally {
            if (!submitted) {
                task.close();
            }
        }
    }
}
