package org.dissync.state;

import java.util.NoSuchElementException;

/**
 * Thrown when a state holds no artifact under the requested key. Callers treat it as
 * "nothing to sync for this key".
 */
public class ArtifactNotFoundException extends NoSuchElementException {

    public ArtifactNotFoundException(String message) {
        super(message);
    }
}
