package org.dissync.controller;

/**
 * The info surface was closed by the user and can no longer be refreshed.
 */
public class SurfaceClosedException extends Exception {

    public SurfaceClosedException(String message) {
        super(message);
    }
}
