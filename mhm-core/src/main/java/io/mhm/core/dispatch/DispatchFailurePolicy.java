package io.mhm.core.dispatch;

import io.mhm.core.model.ExternalUser;

/**
 * Decides what happens when a welcome could not even be handed to the event loop
 * (missing bot, missing or closed loop, submission race).
 */
@FunctionalInterface
public interface DispatchFailurePolicy {
    void onUndispatchable(ExternalUser user, String reason, Throwable cause);
}
