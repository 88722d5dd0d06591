package io.mhm.core.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw webhook body into a {@link DecodeResult}.
 *
 * <p>Envelope: {@code {"type": 0|1, "event": {"type": "APPLICATION_AUTHORIZED", "data": {...}}}}.
 * Numeric type {@code 0} is a PING and is never routed.
 */
public final class WebhookDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookDecoder.class);
    private static final int UNKNOWN_TYPE = -1;

    private final ObjectMapper mapper;

    public WebhookDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public DecodeResult decode(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            return DecodeResult.badRequest("empty_body");
        }

        JsonNode payload;
        try {
            payload = mapper.readTree(rawBody);
        } catch (Exception e) {
            LOG.warn("Invalid JSON in webhook body: {}", e.getMessage());
            return DecodeResult.badRequest("invalid_json");
        }
        if (payload == null || !payload.isObject()) {
            LOG.warn("Webhook body is not a JSON object");
            return DecodeResult.badRequest("invalid_json");
        }

        JsonNode typeNode = payload.get("type");
        int numericType = typeNode != null && typeNode.isIntegralNumber() ? typeNode.intValue() : UNKNOWN_TYPE;
        if (numericType == WebhookEvent.TYPE_PING) {
            return DecodeResult.ping();
        }

        String eventType = textValue(payload.path("event").path("type"));
        if (eventType.isEmpty()) {
            eventType = textValue(payload.path("event_type"));
            if (!eventType.isEmpty()) {
                LOG.warn("Webhook payload missing event.type, using top-level event_type={}", eventType);
            }
        }
        if (eventType.isEmpty()) {
            LOG.warn("Could not determine webhook event type (numeric type={})", numericType);
            return DecodeResult.badRequest("missing_event_type");
        }

        return DecodeResult.event(new WebhookEvent(numericType, eventType.toUpperCase(Locale.ROOT), payload));
    }

    private static String textValue(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return "";
        }
        return node.asText().trim();
    }
}
