package org.dissync.data;

/**
 * Thrown when serialized artifact text cannot be turned back into an artifact.
 */
public class ArtifactFormatException extends RuntimeException {

    public ArtifactFormatException(String message) {
        super(message);
    }

    public ArtifactFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
