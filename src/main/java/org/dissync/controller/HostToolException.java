package org.dissync.controller;

/**
 * A call into the host tool failed.
 */
public class HostToolException extends Exception {

    public HostToolException(String message) {
        super(message);
    }

    public HostToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
