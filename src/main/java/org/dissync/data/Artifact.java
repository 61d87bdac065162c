package org.dissync.data;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A unit of analysis work that is synchronized between analysts.
 * <p>
 * Artifacts are immutable. Equality is content equality: the {@link #getLastChange() last change}
 * timestamp and representation metadata never take part in it, so two analysts holding the same
 * data at different times compare equal.
 */
public interface Artifact {

    /**
     * Timestamp of an artifact nobody has changed yet.
     */
    long NEVER_CHANGED = -1L;

    /**
     * Returns the stable key under which this artifact is stored in a serialized table.
     *
     * @return A hex address, a signed hex offset or a name.
     */
    String key();

    /**
     * Returns the epoch second of the last local or remote change, or {@link #NEVER_CHANGED}.
     *
     * @return The last change timestamp.
     */
    long getLastChange();

    /**
     * Converts the artifact to a tree that serializes as one TOML table.
     *
     * @return A new node holding every field including the timestamp.
     */
    ObjectNode toNode();
}
