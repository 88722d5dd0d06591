package io.mhm.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MhmConfig(
    WebhookConfig webhook,
    DiscordConfig discord,
    StorageConfig storage
) {

    public static MhmConfig defaults() {
        return new MhmConfig(
            WebhookConfig.defaults(),
            DiscordConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
