package io.mhm.core.welcome;

import java.util.Map;
import java.util.Optional;

/**
 * Idempotency ledger for one-time welcome notifications, keyed by {@code channelType:externalId}.
 */
public interface WelcomeStore {
    boolean has(String channelType, String externalId);

    /**
     * Records the user as welcomed. Returns {@code false} only when the ledger could not be written.
     */
    boolean mark(String channelType, String externalId);

    /**
     * Removes the user's record. Clearing an absent record succeeds.
     */
    boolean clear(String channelType, String externalId);

    Optional<WelcomeRecord> find(String channelType, String externalId);

    Map<String, WelcomeRecord> list();

    static String key(String channelType, String externalId) {
        return channelType + ":" + externalId;
    }
}
