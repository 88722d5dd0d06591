package io.mhm.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookConfig(
    String host,
    int port,
    String publicKey,
    boolean allowUnsignedRequests
) {

    public static WebhookConfig defaults() {
        return new WebhookConfig("0.0.0.0", 8080, "", false);
    }

    public boolean signed() {
        return publicKey != null && !publicKey.isBlank();
    }
}
