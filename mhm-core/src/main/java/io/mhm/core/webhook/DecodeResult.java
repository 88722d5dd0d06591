package io.mhm.core.webhook;

public record DecodeResult(Kind kind, WebhookEvent event, String error) {

    public enum Kind {
        EVENT,
        PING,
        BAD_REQUEST
    }

    public static DecodeResult event(WebhookEvent event) {
        return new DecodeResult(Kind.EVENT, event, null);
    }

    public static DecodeResult ping() {
        return new DecodeResult(Kind.PING, null, null);
    }

    public static DecodeResult badRequest(String error) {
        return new DecodeResult(Kind.BAD_REQUEST, null, error);
    }
}
