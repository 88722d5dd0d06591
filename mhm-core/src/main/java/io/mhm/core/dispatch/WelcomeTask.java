package io.mhm.core.dispatch;

import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.WelcomeMessages;
import io.mhm.core.welcome.WelcomeStore;
import io.mhm.core.welcome.WelcomeView;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot welcome DM for a single user. Either submitted to an {@link EventLoop} exactly once
 * or disposed with {@link #close()}; a disposed task that still gets started does nothing.
 *
 * <p>The ledger is only written when the DM was delivered. Delivery failures leave it unset so
 * the in-conversation welcome can still fire.
 */
public final class WelcomeTask implements AsyncWork<Boolean>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WelcomeTask.class);

    private final ExternalUser user;
    private final BotHandle bot;
    private final WelcomeStore store;
    private final Duration settleDelay;
    private final String message;
    private final WelcomeView view;
    private final AtomicReference<TicketState> state;

    public WelcomeTask(ExternalUser user, BotHandle bot, WelcomeStore store, Duration settleDelay) {
        this.user = user;
        this.bot = bot;
        this.store = store;
        this.settleDelay = settleDelay == null ? Duration.ZERO : settleDelay;
        this.message = WelcomeMessages.forAuthorization(user.displayName());
        this.view = WelcomeView.accountChoices(user.externalId());
        this.state = new AtomicReference<>(TicketState.CREATED);
    }

    public TicketState state() {
        return state.get();
    }

    void markSubmitted() {
        state.compareAndSet(TicketState.CREATED, TicketState.SUBMITTED);
    }

    @Override
    public CompletionStage<Boolean> start(EventLoop loop) {
        TicketState previous = state.getAndUpdate(current ->
            current == TicketState.CREATED || current == TicketState.SUBMITTED ? TicketState.RUNNING : current
        );
        if (previous != TicketState.CREATED && previous != TicketState.SUBMITTED) {
            LOG.debug("Welcome task for {} not started, state was {}", user.externalId(), previous);
            return CompletableFuture.completedFuture(false);
        }

        // the settle delay is not cancellable
        return loop.sleep(settleDelay)
            .thenCompose(ignored -> bot.fetchUser(user.externalId()))
            .thenComposeAsync(recipient -> recipient.send(message, view), loop)
            .handleAsync(this::finish, loop);
    }

    @Override
    public void close() {
        TicketState previous = state.getAndUpdate(current -> current == TicketState.CREATED ? TicketState.DISPOSED : current);
        if (previous == TicketState.CREATED) {
            LOG.debug("Disposed unsubmitted welcome task for {}", user.externalId());
        }
    }

    private boolean finish(Void ignored, Throwable error) {
        if (error == null) {
            state.set(TicketState.COMPLETED);
            store.mark(user.channelType(), user.externalId());
            LOG.info("Sent welcome DM to newly authorized {} user {}", user.channelType(), user.externalId());
            return true;
        }

        state.set(TicketState.FAILED);
        Throwable cause = unwrap(error);
        if (cause instanceof RecipientUnreachableException) {
            LOG.warn(
                "Could not DM {} user {} ({}); they will be welcomed on their first interaction instead",
                user.channelType(),
                user.externalId(),
                cause.getMessage()
            );
        } else {
            LOG.error("Failed to send welcome DM to {} user {}", user.channelType(), user.externalId(), cause);
        }
        return false;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
