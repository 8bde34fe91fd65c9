package de.bsommerfeld.canvas.core.concurrent;

/**
 * What a remote call answered: whether the server accepted the request and
 * the message it sent along.
 */
public record RemoteReply(boolean success, String message) {

    public static RemoteReply accepted(String message) {
        return new RemoteReply(true, message);
    }

    public static RemoteReply rejected(String message) {
        return new RemoteReply(false, message);
    }
}
