package org.iscc.omero.exception;

/**
 * Best-effort notification failed. Never affects pipeline state.
 */
public class NotificationException extends IsccServiceException {

    public NotificationException(String target, String message) {
        super("NOTIFICATION_ERROR", "notify", String.format("%s: %s", target, message));
    }

    public NotificationException(String target, String message, Throwable cause) {
        super("NOTIFICATION_ERROR", "notify", String.format("%s: %s", target, message), cause);
    }
}
