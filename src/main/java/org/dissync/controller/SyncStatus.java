package org.dissync.controller;

public enum SyncStatus {
    CONNECTED,
    CONNECTED_NO_REMOTE,
    DISCONNECTED
}
