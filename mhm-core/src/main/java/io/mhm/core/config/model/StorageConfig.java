package io.mhm.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Where the welcome ledger and identity directory live. {@code zone} controls the
 * human-readable timestamp written next to each welcome.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String dataDir,
    String zone
) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.mhm/data", "UTC");
    }
}
