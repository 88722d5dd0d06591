package io.mhm.core.webhook;

@FunctionalInterface
public interface WebhookEventHandler {
    RouteOutcome handle(WebhookEvent event);
}
