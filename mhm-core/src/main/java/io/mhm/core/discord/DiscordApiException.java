package io.mhm.core.discord;

public class DiscordApiException extends RuntimeException {
    private final int httpStatus;
    private final int errorCode;

    public DiscordApiException(int httpStatus, int errorCode, String message) {
        super("Discord API error " + httpStatus + " (code " + errorCode + "): " + message);
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int errorCode() {
        return errorCode;
    }
}
