package org.dissync.client;

/**
 * Non-fatal conditions detected while connecting to a sync repository.
 */
public enum ConnectionWarning {

    /**
     * The repository was created for a different binary than the one open in the host tool.
     */
    HASH_MISMATCH
}
