package org.dissync.service;

import java.time.Instant;

/**
 * A transient failure a background service recovered from.
 *
 * @param timestamp When the failure happened.
 * @param errorType A category, e.g. {@code "DRAIN_FAILED"}.
 * @param message   A human-readable description.
 * @param details   Additional context such as the affected command.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
