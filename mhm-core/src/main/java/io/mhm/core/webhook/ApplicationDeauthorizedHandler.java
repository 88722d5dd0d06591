package io.mhm.core.webhook;

import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.WelcomeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forgets the welcome so a later re-install is greeted again.
 */
public final class ApplicationDeauthorizedHandler implements WebhookEventHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ApplicationDeauthorizedHandler.class);

    private final String channelType;
    private final WelcomeStore store;

    public ApplicationDeauthorizedHandler(String channelType, WelcomeStore store) {
        this.channelType = channelType;
        this.store = store;
    }

    @Override
    public RouteOutcome handle(WebhookEvent event) {
        ExternalUser user = event.user(channelType);
        if (!user.hasId()) {
            LOG.warn("{} event missing user id", event.eventType());
            return RouteOutcome.REJECTED;
        }
        LOG.info("User deauthorized app: {} id {}, username {}", channelType, user.externalId(), user.displayName());
        if (!store.clear(channelType, user.externalId())) {
            return RouteOutcome.FAILED;
        }
        LOG.debug("Cleared welcomed status for {} user {}", channelType, user.externalId());
        return RouteOutcome.ACKNOWLEDGED;
    }
}
