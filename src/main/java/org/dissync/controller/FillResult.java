package org.dissync.controller;

/**
 * Outcome of applying one user's function to the host tool.
 */
public enum FillResult {
    /** Differing artifacts were applied. */
    APPLIED,
    /** The source user's function already matches the master state. */
    NO_CHANGE,
    /** The host tool has no function at the address. */
    FUNCTION_MISSING
}
