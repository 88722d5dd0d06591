package io.mhm.core.dispatch;

/**
 * The platform refused a direct message to this user, typically because of their privacy
 * settings or because the install handshake has not finished yet.
 */
public class RecipientUnreachableException extends RuntimeException {

    public RecipientUnreachableException(String message) {
        super(message);
    }
}
