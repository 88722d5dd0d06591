package io.mhm.core.webhook;

import io.mhm.core.dispatch.BotHandle;
import io.mhm.core.dispatch.WelcomeDispatcher;
import io.mhm.core.identity.IdentityDirectory;
import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.WelcomeStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Welcomes a user who just installed the app, unless they already have an account or were
 * welcomed before. Repeated deliveries of the same event are no-ops once the ledger is set.
 */
public final class ApplicationAuthorizedHandler implements WebhookEventHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ApplicationAuthorizedHandler.class);

    private final String channelType;
    private final WelcomeStore store;
    private final IdentityDirectory identities;
    private final WelcomeDispatcher dispatcher;
    private final BotHandle bot;

    public ApplicationAuthorizedHandler(
        String channelType,
        WelcomeStore store,
        IdentityDirectory identities,
        WelcomeDispatcher dispatcher,
        BotHandle bot
    ) {
        this.channelType = channelType;
        this.store = store;
        this.identities = identities;
        this.dispatcher = dispatcher;
        this.bot = bot;
    }

    @Override
    public RouteOutcome handle(WebhookEvent event) {
        ExternalUser user = event.user(channelType);
        if (!user.hasId()) {
            LOG.warn("{} event missing user id", event.eventType());
            return RouteOutcome.REJECTED;
        }
        LOG.info("User authorized app: {} id {}, username {}", channelType, user.externalId(), user.displayName());

        try {
            identities.recordDisplayName(user);
        } catch (Exception e) {
            LOG.warn("Could not record display name for {} user {}", channelType, user.externalId(), e);
        }

        Optional<String> linked = identities.linkedUserId(channelType, user.externalId());
        if (linked.isPresent()) {
            LOG.debug("{} user {} already linked to account {}", channelType, user.externalId(), linked.get());
            return RouteOutcome.ACKNOWLEDGED;
        }

        if (store.has(channelType, user.externalId())) {
            LOG.debug("{} user {} already welcomed", channelType, user.externalId());
            return RouteOutcome.ACKNOWLEDGED;
        }

        return dispatcher.dispatchNotification(user, bot) ? RouteOutcome.ACKNOWLEDGED : RouteOutcome.FAILED;
    }
}
