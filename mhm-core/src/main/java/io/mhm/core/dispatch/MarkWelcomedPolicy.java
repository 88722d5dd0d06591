package io.mhm.core.dispatch;

import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.WelcomeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks the user welcomed even though nothing was sent, so webhook redeliveries stop
 * retrying against a dead runtime. The in-conversation welcome remains the fallback.
 */
public final class MarkWelcomedPolicy implements DispatchFailurePolicy {
    private static final Logger LOG = LoggerFactory.getLogger(MarkWelcomedPolicy.class);

    private final WelcomeStore store;

    public MarkWelcomedPolicy(WelcomeStore store) {
        this.store = store;
    }

    @Override
    public void onUndispatchable(ExternalUser user, String reason, Throwable cause) {
        if (cause == null) {
            LOG.warn("Skipping welcome DM for {} user {}: {}", user.channelType(), user.externalId(), reason);
        } else {
            LOG.warn("Skipping welcome DM for {} user {}: {}", user.channelType(), user.externalId(), reason, cause);
        }
        if (!store.mark(user.channelType(), user.externalId())) {
            LOG.error("Could not record skipped welcome for {} user {}", user.channelType(), user.externalId());
        }
    }
}
