package io.mhm.core.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import io.mhm.core.model.ExternalUser;

public record WebhookEvent(int numericType, String eventType, JsonNode payload) {
    public static final int TYPE_PING = 0;
    public static final String APPLICATION_AUTHORIZED = "APPLICATION_AUTHORIZED";
    public static final String APPLICATION_DEAUTHORIZED = "APPLICATION_DEAUTHORIZED";

    /**
     * The user carried in {@code event.data.user}; the id is blank when the payload has none.
     */
    public ExternalUser user(String channelType) {
        JsonNode user = payload.path("event").path("data").path("user");
        return new ExternalUser(
            textOrEmpty(user.get("id")),
            textOrEmpty(user.get("username")),
            channelType
        );
    }

    private static String textOrEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText("");
    }
}
