package io.mhm.core.webhook;

public enum RouteOutcome {
    ACKNOWLEDGED(200),
    REJECTED(400),
    FAILED(500);

    private final int httpStatus;

    RouteOutcome(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
