package org.dissync.controller;

/**
 * The most recent change any user made to one function.
 *
 * @param address    The function address.
 * @param localName  The function's name in the host tool, empty if unknown.
 * @param user       The user who changed it last.
 * @param lastChange When, in epoch seconds.
 */
public record FunctionActivity(long address, String localName, String user, long lastChange) {

    /**
     * @return The age of the change as shown on the info surface, e.g. {@code "5 minutes ago"}.
     */
    public String age(long nowEpochSeconds) {
        return TimeFormat.friendly(lastChange, nowEpochSeconds);
    }
}
