package org.dissync.client;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Version-control primitives the client needs from the shared repository.
 * <p>
 * Every user owns one line of history. Reads always come from committed history, never from
 * files being written, so readers cannot observe a half-written snapshot.
 */
public interface SyncRepository extends AutoCloseable {

    /**
     * @return {@code true} if the repository has the shared remote configured.
     */
    boolean hasRemote();

    /**
     * Fetches every user's history from the remote. Does not touch the local user's history.
     *
     * @throws IOException if the remote cannot be reached.
     */
    void fetch() throws IOException;

    /**
     * Publishes the local user's history to the remote.
     *
     * @throws IOException if the remote rejects or cannot be reached.
     */
    void push() throws IOException;

    /**
     * Replaces the local user's directory with exactly {@code files} and commits the result.
     *
     * @param files   File contents keyed by path relative to the user's directory.
     * @param message The commit message.
     * @return {@code true} if a commit was made, {@code false} if the files were already committed.
     * @throws IOException if writing or committing fails; the committed history is unchanged then.
     */
    boolean commit(Map<String, byte[]> files, String message) throws IOException;

    /**
     * Reads a user's directory.
     *
     * @param user    The user whose files to read.
     * @param version A commit id, or {@code null} for the user's latest known version.
     * @return The files, or empty if the user has no history yet.
     * @throws IOException if the version does not exist or cannot be read.
     */
    Optional<StoredSnapshot> read(String user, String version) throws IOException;

    /**
     * Reads a repository-wide record from the root history.
     *
     * @param name The file name at the repository root.
     * @return The content, or empty if absent.
     */
    Optional<String> readRootFile(String name) throws IOException;

    /**
     * @return The users that have a history locally or on the remote, sorted by name.
     */
    List<String> users() throws IOException;

    /**
     * @return The identity this repository writes for.
     */
    String getUser();

    @Override
    void close();
}
