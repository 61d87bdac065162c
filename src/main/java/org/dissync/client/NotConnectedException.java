package org.dissync.client;

/**
 * Thrown when a state operation is attempted before a sync repository was connected.
 */
public class NotConnectedException extends IllegalStateException {

    public NotConnectedException() {
        super("Not connected to a sync repository");
    }

    public NotConnectedException(String message) {
        super(message);
    }
}
