package io.mhm.core.webhook;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes decoded events by their upper-cased type. Unknown types are acknowledged so
 * at-least-once senders do not keep redelivering them.
 */
public final class WebhookEventRouter {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookEventRouter.class);

    private final Map<String, WebhookEventHandler> handlers = new ConcurrentHashMap<>();

    public WebhookEventRouter register(String eventType, WebhookEventHandler handler) {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.put(eventType.toUpperCase(Locale.ROOT), handler);
        return this;
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    public RouteOutcome route(WebhookEvent event) {
        WebhookEventHandler handler = handlers.get(event.eventType());
        if (handler == null) {
            LOG.debug("Unhandled webhook event type: {}", event.eventType());
            return RouteOutcome.ACKNOWLEDGED;
        }
        return handler.handle(event);
    }
}
